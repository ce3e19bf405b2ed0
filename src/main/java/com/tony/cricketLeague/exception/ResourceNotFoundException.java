package com.tony.cricketLeague.exception;

/**
 * Entité référencée absente (joueur, équipe, match...). Fatal pour l'opération en cours.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resourceType, Object id) {
        super(String.format("%s not found: %s", resourceType, id));
    }
}
