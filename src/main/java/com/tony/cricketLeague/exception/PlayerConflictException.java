package com.tony.cricketLeague.exception;

import com.tony.cricketLeague.model.dto.PlayerConflict;

/**
 * Collision d'email lors de la création/modification d'un joueur.
 * Porte le payload structuré pour que l'appelant propose une fusion ou un autre email.
 */
public class PlayerConflictException extends RuntimeException {

    private final PlayerConflict conflict;

    public PlayerConflictException(PlayerConflict conflict) {
        super("Email conflict detected");
        this.conflict = conflict;
    }

    public PlayerConflict getConflict() {
        return conflict;
    }
}
