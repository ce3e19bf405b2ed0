package com.tony.cricketLeague.model;

import com.tony.cricketLeague.util.OversConverter;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agrégat carrière d'un joueur. Uniquement des compteurs : les moyennes et taux sont
 * calculés à la lecture pour ne jamais stocker une valeur dérivée périmée.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CareerStats {

    // --- BATTING ---
    private int totalRuns;
    private int totalBallsFaced;
    private int totalFours;
    private int totalSixes;
    private int highestScore;
    private int centuries;
    private int halfCenturies;
    private int innings;
    private int dismissals;

    // --- BOWLING ---
    // Stocké en balles : additionner des overs décimaux (3.4 + 2.4) donnerait un faux total
    private int totalBallsBowled;
    private int totalRunsConceded;
    private int totalWickets;
    private int totalMaidens;
    private Integer bestBowlingWickets;
    private Integer bestBowlingRuns;
    private int fiveWicketHauls;

    // --- FIELDING ---
    private int catches;
    private int runOuts;
    private int stumpings;

    // --- MATCHS ---
    private int totalMatches;
    private int matchesWon;

    // --- RÉCOMPENSES ---
    private int manOfTheMatchAwards;
    private int bestBatsmanAwards;
    private int bestBowlerAwards;
    private int bestFielderAwards;

    public static CareerStats empty() {
        return new CareerStats();
    }

    // --- Dérivés (null = non défini, à ne pas confondre avec un vrai 0) ---

    public Double getBattingAverage() {
        if (dismissals == 0) return null;
        return round2((double) totalRuns / dismissals);
    }

    public Double getStrikeRate() {
        if (totalBallsFaced == 0) return null;
        return round2((double) totalRuns / totalBallsFaced * 100);
    }

    public Double getBowlingAverage() {
        if (totalWickets == 0) return null;
        return round2((double) totalRunsConceded / totalWickets);
    }

    public Double getEconomy() {
        if (totalBallsBowled == 0) return null;
        return round2(totalRunsConceded / (totalBallsBowled / (double) OversConverter.BALLS_PER_OVER));
    }

    public double getOversBowled() {
        return OversConverter.ballsToOvers(totalBallsBowled);
    }

    /** Ex: "4/25", null si le joueur n'a jamais lancé. */
    public String getBestBowlingFigures() {
        if (bestBowlingWickets == null || bestBowlingRuns == null) return null;
        return bestBowlingWickets + "/" + bestBowlingRuns;
    }

    private static double round2(double val) {
        return Math.round(val * 100.0) / 100.0;
    }
}
