package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BattingStats {
    private Integer runs;
    private Integer balls;
    private Integer fours;
    private Integer sixes;
    private Boolean dismissed;
    private String dismissalType; // caught, bowled, run-out, not-out...

    public int runsOrZero() {
        return runs != null ? runs : 0;
    }

    public int ballsOrZero() {
        return balls != null ? balls : 0;
    }

    public boolean wasDismissed() {
        return Boolean.TRUE.equals(dismissed);
    }

    // Helper pour le strike rate du match
    public Double getStrikeRate() {
        if (balls == null || balls == 0) return null;
        return Math.round((double) runsOrZero() / balls * 100 * 100.0) / 100.0;
    }
}
