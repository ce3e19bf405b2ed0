package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ligne batteur d'un scorecard.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatsmanEntry {
    private Long playerId;
    private Integer runsScored;
    private Integer ballsFaced;
    private Integer fours;
    private Integer sixes;
    private String dismissalType; // null ou "not-out" = pas éliminé
    private Long fielderId;       // receveur, auteur du run-out ou du stumping

    public boolean isDismissed() {
        return dismissalType != null && !dismissalType.isBlank() && !"not-out".equalsIgnoreCase(dismissalType);
    }
}
