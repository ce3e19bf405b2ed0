package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.Award;
import com.tony.cricketLeague.model.BattingStats;
import com.tony.cricketLeague.model.BowlingStats;
import com.tony.cricketLeague.model.CareerStats;
import com.tony.cricketLeague.model.FieldingStats;
import com.tony.cricketLeague.model.dto.MatchPerformanceInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class CareerStatsAccumulatorTest {

    private CareerStatsAccumulator accumulator;

    @BeforeEach
    void setUp() {
        accumulator = new CareerStatsAccumulator();
    }

    @Test
    @DisplayName("Un match complet met à jour tous les compteurs")
    void shouldAccumulateFullPerformance() {
        MatchPerformanceInput delta = MatchPerformanceInput.builder()
                .batting(new BattingStats(104, 80, 10, 3, true, "caught"))
                .bowling(new BowlingStats(3.4, 1, 25, 5))
                .fielding(new FieldingStats(2, 1, 0))
                .matchWon(true)
                .awards(EnumSet.of(Award.MAN_OF_THE_MATCH, Award.BEST_BATSMAN))
                .build();

        CareerStats stats = accumulator.accumulate(CareerStats.empty(), delta);

        assertThat(stats.getTotalRuns()).isEqualTo(104);
        assertThat(stats.getTotalBallsFaced()).isEqualTo(80);
        assertThat(stats.getTotalFours()).isEqualTo(10);
        assertThat(stats.getTotalSixes()).isEqualTo(3);
        assertThat(stats.getInnings()).isEqualTo(1);
        assertThat(stats.getDismissals()).isEqualTo(1);
        assertThat(stats.getCenturies()).isEqualTo(1);
        assertThat(stats.getHalfCenturies()).isZero();
        assertThat(stats.getHighestScore()).isEqualTo(104);

        assertThat(stats.getTotalBallsBowled()).isEqualTo(22);
        assertThat(stats.getOversBowled()).isEqualTo(3.4);
        assertThat(stats.getTotalWickets()).isEqualTo(5);
        assertThat(stats.getFiveWicketHauls()).isEqualTo(1);
        assertThat(stats.getBestBowlingFigures()).isEqualTo("5/25");

        assertThat(stats.getCatches()).isEqualTo(2);
        assertThat(stats.getRunOuts()).isEqualTo(1);
        assertThat(stats.getTotalMatches()).isEqualTo(1);
        assertThat(stats.getMatchesWon()).isEqualTo(1);
        assertThat(stats.getManOfTheMatchAwards()).isEqualTo(1);
        assertThat(stats.getBestBatsmanAwards()).isEqualTo(1);
        assertThat(stats.getBestBowlerAwards()).isZero();
    }

    @Test
    @DisplayName("Sans garde de l'appelant, le même delta appliqué deux fois compte double")
    void accumulatorDoesNotDeduplicate() {
        MatchPerformanceInput delta = MatchPerformanceInput.builder()
                .batting(new BattingStats(30, 20, 4, 0, false, "not-out"))
                .matchWon(false)
                .build();

        CareerStats once = accumulator.accumulate(CareerStats.empty(), delta);
        CareerStats twice = accumulator.accumulate(once, delta);

        assertThat(twice.getTotalRuns()).isEqualTo(60);
        assertThat(twice.getTotalMatches()).isEqualTo(2);
        assertThat(twice.getInnings()).isEqualTo(2);
    }

    @Test
    @DisplayName("L'agrégat d'entrée n'est jamais modifié")
    void shouldNotMutateExistingStats() {
        CareerStats existing = CareerStats.builder().totalRuns(50).totalMatches(3).build();
        MatchPerformanceInput delta = MatchPerformanceInput.builder()
                .batting(new BattingStats(10, 12, 1, 0, true, "bowled"))
                .build();

        CareerStats result = accumulator.accumulate(existing, delta);

        assertThat(existing.getTotalRuns()).isEqualTo(50);
        assertThat(existing.getTotalMatches()).isEqualTo(3);
        assertThat(result.getTotalRuns()).isEqualTo(60);
        assertThat(result.getTotalMatches()).isEqualTo(4);
    }

    @Test
    @DisplayName("Moyennes non définies = null, jamais 0")
    void derivedStatsShouldBeNullWhenUndefined() {
        MatchPerformanceInput delta = MatchPerformanceInput.builder()
                .batting(new BattingStats(45, 30, 5, 1, false, "not-out"))
                .build();

        CareerStats stats = accumulator.accumulate(CareerStats.empty(), delta);

        assertThat(stats.getBattingAverage()).isNull();
        assertThat(stats.getStrikeRate()).isEqualTo(150.0);
        assertThat(stats.getBowlingAverage()).isNull();
        assertThat(stats.getEconomy()).isNull();
        assertThat(stats.getBestBowlingFigures()).isNull();
    }

    @Test
    @DisplayName("Meilleure figure : plus de wickets, puis moins de runs")
    void bestBowlingShouldPreferWicketsThenRuns() {
        CareerStats stats = CareerStats.empty();
        stats = accumulator.accumulate(stats, bowling(4.0, 30, 3));
        stats = accumulator.accumulate(stats, bowling(4.0, 18, 3));
        stats = accumulator.accumulate(stats, bowling(4.0, 10, 2));

        assertThat(stats.getBestBowlingFigures()).isEqualTo("3/18");
        assertThat(stats.getTotalBallsBowled()).isEqualTo(72);
        assertThat(stats.getEconomy()).isEqualTo(4.83);
        assertThat(stats.getBowlingAverage()).isEqualTo(7.25);
    }

    @Test
    @DisplayName("Fusion de carrières : compteurs additionnés, records conservés")
    void combineShouldSumCountersAndKeepRecords() {
        CareerStats target = CareerStats.builder()
                .totalRuns(300).highestScore(88).totalMatches(10).totalWickets(4)
                .bestBowlingWickets(2).bestBowlingRuns(20).build();
        CareerStats source = CareerStats.builder()
                .totalRuns(120).highestScore(102).totalMatches(3).totalWickets(6)
                .bestBowlingWickets(4).bestBowlingRuns(31).build();

        CareerStats combined = accumulator.combine(target, source);

        assertThat(combined.getTotalRuns()).isEqualTo(420);
        assertThat(combined.getTotalMatches()).isEqualTo(13);
        assertThat(combined.getTotalWickets()).isEqualTo(10);
        assertThat(combined.getHighestScore()).isEqualTo(102);
        assertThat(combined.getBestBowlingFigures()).isEqualTo("4/31");
    }

    private MatchPerformanceInput bowling(double overs, int runs, int wickets) {
        return MatchPerformanceInput.builder()
                .bowling(new BowlingStats(overs, 0, runs, wickets))
                .build();
    }
}
