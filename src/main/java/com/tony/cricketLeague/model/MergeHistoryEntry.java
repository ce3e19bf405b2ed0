package com.tony.cricketLeague.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeHistoryEntry {
    private Instant mergedAt;
    private Long sourcePlayerId;
    private String mergedBy;

    // Liste des champs repris du joueur source, séparés par des virgules
    @Column(length = 512)
    private String mergedFields;
}
