package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.FieldChoice;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Fusion d'un joueur source dans un joueur cible (existant).
 * La source est soit un joueur enregistré (sourcePlayerId), soit les données candidates
 * d'une création bloquée par un conflit d'email (candidate), jamais les deux.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {
    @NotNull(message = "targetPlayerId est requis")
    private Long targetPlayerId;

    private Long sourcePlayerId;

    @Valid
    private PlayerRequest candidate;

    // Clé = nom du champ (name, teamName, role...), valeur = existing | new
    private Map<String, FieldChoice> fieldResolutions = new HashMap<>();

    // null = automatique : on cumule seulement si le joueur source a déjà un historique
    private Boolean combineCareerStats;

    private String mergedBy;
}
