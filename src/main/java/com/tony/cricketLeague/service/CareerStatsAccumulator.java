package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.Award;
import com.tony.cricketLeague.model.BattingStats;
import com.tony.cricketLeague.model.BowlingStats;
import com.tony.cricketLeague.model.CareerStats;
import com.tony.cricketLeague.model.FieldingStats;
import com.tony.cricketLeague.model.dto.MatchPerformanceInput;
import org.springframework.stereotype.Component;

/**
 * Fusionne la performance d'un match dans l'agrégat carrière d'un joueur.
 * <p>
 * Fonction pure : aucune déduplication ici. Appliquer deux fois le même delta compte deux fois.
 * Le contrôle (matchId, playerId) est fait par {@link PlayerStatsService#recordPerformance}.
 */
@Component
public class CareerStatsAccumulator {

    static final int CENTURY = 100;
    static final int HALF_CENTURY = 50;
    static final int FIVE_WICKET_HAUL = 5;

    public CareerStats accumulate(CareerStats existing, MatchPerformanceInput delta) {
        CareerStats base = existing != null ? existing : CareerStats.empty();
        CareerStats stats = base.toBuilder().build();

        // 1. Batte
        BattingStats batting = delta.getBatting();
        if (batting != null) {
            int runs = batting.runsOrZero();
            stats.setTotalRuns(stats.getTotalRuns() + runs);
            stats.setTotalBallsFaced(stats.getTotalBallsFaced() + batting.ballsOrZero());
            stats.setTotalFours(stats.getTotalFours() + orZero(batting.getFours()));
            stats.setTotalSixes(stats.getTotalSixes() + orZero(batting.getSixes()));
            stats.setInnings(stats.getInnings() + 1);
            if (batting.wasDismissed()) {
                stats.setDismissals(stats.getDismissals() + 1);
            }
            if (runs > stats.getHighestScore()) {
                stats.setHighestScore(runs);
            }
            if (runs >= CENTURY) {
                stats.setCenturies(stats.getCenturies() + 1);
            } else if (runs >= HALF_CENTURY) {
                stats.setHalfCenturies(stats.getHalfCenturies() + 1);
            }
        }

        // 2. Lancer (en balles, jamais en overs décimaux)
        BowlingStats bowling = delta.getBowling();
        if (bowling != null) {
            int wickets = bowling.wicketsOrZero();
            int runsConceded = bowling.runsOrZero();
            stats.setTotalBallsBowled(stats.getTotalBallsBowled() + bowling.ballsBowled());
            stats.setTotalRunsConceded(stats.getTotalRunsConceded() + runsConceded);
            stats.setTotalWickets(stats.getTotalWickets() + wickets);
            stats.setTotalMaidens(stats.getTotalMaidens() + bowling.maidensOrZero());
            if (wickets >= FIVE_WICKET_HAUL) {
                stats.setFiveWicketHauls(stats.getFiveWicketHauls() + 1);
            }
            if (isBetterBowling(wickets, runsConceded, stats.getBestBowlingWickets(), stats.getBestBowlingRuns())) {
                stats.setBestBowlingWickets(wickets);
                stats.setBestBowlingRuns(runsConceded);
            }
        }

        // 3. Terrain
        FieldingStats fielding = delta.getFielding();
        if (fielding != null) {
            stats.setCatches(stats.getCatches() + fielding.getCatches());
            stats.setRunOuts(stats.getRunOuts() + fielding.getRunOuts());
            stats.setStumpings(stats.getStumpings() + fielding.getStumpings());
        }

        // 4. Match & récompenses
        stats.setTotalMatches(stats.getTotalMatches() + 1);
        if (delta.isMatchWon()) {
            stats.setMatchesWon(stats.getMatchesWon() + 1);
        }
        for (Award award : delta.getAwards()) {
            switch (award) {
                case MAN_OF_THE_MATCH -> stats.setManOfTheMatchAwards(stats.getManOfTheMatchAwards() + 1);
                case BEST_BATSMAN -> stats.setBestBatsmanAwards(stats.getBestBatsmanAwards() + 1);
                case BEST_BOWLER -> stats.setBestBowlerAwards(stats.getBestBowlerAwards() + 1);
                case BEST_FIELDER -> stats.setBestFielderAwards(stats.getBestFielderAwards() + 1);
            }
        }

        return stats;
    }

    /**
     * Somme de deux carrières (fusion de joueurs). Compteurs additionnés, meilleur score = max,
     * meilleure figure au lancer = la meilleure des deux.
     */
    public CareerStats combine(CareerStats a, CareerStats b) {
        CareerStats left = a != null ? a : CareerStats.empty();
        CareerStats right = b != null ? b : CareerStats.empty();

        CareerStats combined = CareerStats.builder()
                .totalRuns(left.getTotalRuns() + right.getTotalRuns())
                .totalBallsFaced(left.getTotalBallsFaced() + right.getTotalBallsFaced())
                .totalFours(left.getTotalFours() + right.getTotalFours())
                .totalSixes(left.getTotalSixes() + right.getTotalSixes())
                .highestScore(Math.max(left.getHighestScore(), right.getHighestScore()))
                .centuries(left.getCenturies() + right.getCenturies())
                .halfCenturies(left.getHalfCenturies() + right.getHalfCenturies())
                .innings(left.getInnings() + right.getInnings())
                .dismissals(left.getDismissals() + right.getDismissals())
                .totalBallsBowled(left.getTotalBallsBowled() + right.getTotalBallsBowled())
                .totalRunsConceded(left.getTotalRunsConceded() + right.getTotalRunsConceded())
                .totalWickets(left.getTotalWickets() + right.getTotalWickets())
                .totalMaidens(left.getTotalMaidens() + right.getTotalMaidens())
                .fiveWicketHauls(left.getFiveWicketHauls() + right.getFiveWicketHauls())
                .catches(left.getCatches() + right.getCatches())
                .runOuts(left.getRunOuts() + right.getRunOuts())
                .stumpings(left.getStumpings() + right.getStumpings())
                .totalMatches(left.getTotalMatches() + right.getTotalMatches())
                .matchesWon(left.getMatchesWon() + right.getMatchesWon())
                .manOfTheMatchAwards(left.getManOfTheMatchAwards() + right.getManOfTheMatchAwards())
                .bestBatsmanAwards(left.getBestBatsmanAwards() + right.getBestBatsmanAwards())
                .bestBowlerAwards(left.getBestBowlerAwards() + right.getBestBowlerAwards())
                .bestFielderAwards(left.getBestFielderAwards() + right.getBestFielderAwards())
                .bestBowlingWickets(left.getBestBowlingWickets())
                .bestBowlingRuns(left.getBestBowlingRuns())
                .build();

        if (right.getBestBowlingWickets() != null && right.getBestBowlingRuns() != null
                && isBetterBowling(right.getBestBowlingWickets(), right.getBestBowlingRuns(),
                left.getBestBowlingWickets(), left.getBestBowlingRuns())) {
            combined.setBestBowlingWickets(right.getBestBowlingWickets());
            combined.setBestBowlingRuns(right.getBestBowlingRuns());
        }
        return combined;
    }

    // Plus de wickets d'abord, puis moins de runs concédés
    static boolean isBetterBowling(int wickets, int runs, Integer bestWickets, Integer bestRuns) {
        if (bestWickets == null || bestRuns == null) return true;
        if (wickets != bestWickets) return wickets > bestWickets;
        return runs < bestRuns;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
