package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Payload renvoyé (409) quand l'email candidat est déjà porté par un joueur existant.
 */
@Data
@AllArgsConstructor
public class PlayerConflict {
    private String conflictType;
    private Player existingPlayer;
    private PlayerRequest candidate;
    // Champs à arbitrer ("existing" ou "new") : valeurs différentes et toutes deux renseignées
    private List<String> contestedFields;
    private boolean existingPlayerLinkedToUser;
    private String suggestedAction;

    public static PlayerConflict emailExists(Player existing, PlayerRequest candidate, List<String> contestedFields) {
        return new PlayerConflict("email_exists", existing, candidate, contestedFields,
                existing.getUserId() != null, "merge_profiles");
    }
}
