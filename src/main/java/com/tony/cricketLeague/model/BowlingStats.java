package com.tony.cricketLeague.model;

import com.tony.cricketLeague.util.OversConverter;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BowlingStats {
    private Double overs;   // notation cricket : 3.4 = 3 overs + 4 balles
    private Integer maidens;
    private Integer runs;
    private Integer wickets;

    public int ballsBowled() {
        return OversConverter.oversToBalls(overs);
    }

    public int runsOrZero() {
        return runs != null ? runs : 0;
    }

    public int wicketsOrZero() {
        return wickets != null ? wickets : 0;
    }

    public int maidensOrZero() {
        return maidens != null ? maidens : 0;
    }

    public Double getEconomy() {
        int balls = ballsBowled();
        if (balls == 0) return null;
        return Math.round(runsOrZero() / (balls / 6.0) * 100.0) / 100.0;
    }
}
