package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.InningsSide;
import com.tony.cricketLeague.model.MatchOutcome;
import com.tony.cricketLeague.model.ResultSummary;
import com.tony.cricketLeague.model.ResultType;
import com.tony.cricketLeague.model.SkipReason;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.InningsContribution;
import com.tony.cricketLeague.model.dto.TeamMatchClassification;
import com.tony.cricketLeague.model.dto.TeamSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TeamStatsAggregatorTest {

    private TeamStatsAggregator aggregator;
    private TeamResultClassifier classifier;
    private Team teamA;

    @BeforeEach
    void setUp() {
        aggregator = new TeamStatsAggregator(new LeagueStatsProperties());
        classifier = new TeamResultClassifier();
        teamA = new Team("Red", "cricket");
        teamA.setId(1L);
    }

    @Test
    @DisplayName("Scénario complet : une victoire 150/6 contre 140/8 puis un match abandonné")
    void winThenAbandonedMatch() {
        // ARRANGE
        CricketMatch match1 = new CricketMatch(1L, "Red", 2L, "Blue");
        match1.setId(100L);
        match1.setResultSummary(new ResultSummary(ResultType.NORMAL, 1L));
        match1.addInnings(InningsSide.TEAM1, new Innings(1L, 150, 6, 20.0));
        match1.addInnings(InningsSide.TEAM2, new Innings(2L, 140, 8, 20.0));

        CricketMatch match2 = new CricketMatch(1L, "Red", 3L, "Green");
        match2.setId(101L);
        match2.setResultSummary(new ResultSummary(ResultType.ABANDONED, null));

        // ACT
        TeamSummary summary = aggregator.aggregate(teamA, List.of(
                classifier.classify(match1, 1L),
                classifier.classify(match2, 1L)));

        // ASSERT
        assertThat(summary.getWins()).isEqualTo(1);
        assertThat(summary.getTotalMatches()).isEqualTo(1);
        assertThat(summary.getTournamentPoints()).isEqualTo(2);
        assertThat(summary.getWinRate()).isEqualTo(100.0);
        assertThat(summary.isHasNRRData()).isTrue();
        // 150/20 - 140/20
        assertThat(summary.getNetRunRate()).isEqualTo(0.5);
        assertThat(summary.getMatchesSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Aucune balle jouée : pas de NRR (et surtout pas 0.000)")
    void noBallsFacedShouldWithholdNrr() {
        TeamMatchClassification bowledOnly = new TeamMatchClassification(1L, true, MatchOutcome.WIN, null,
                new InningsContribution(), new InningsContribution(120, 10, 110));

        TeamSummary summary = aggregator.aggregate(teamA, List.of(bowledOnly));

        assertThat(summary.getWins()).isEqualTo(1);
        assertThat(summary.getTournamentPoints()).isEqualTo(2);
        assertThat(summary.isHasNRRData()).isFalse();
        assertThat(summary.getNetRunRate()).isNull();
    }

    @Test
    @DisplayName("Aucun match : taux de victoire à 0, pas NaN")
    void emptyHistoryShouldGiveZeroWinRate() {
        TeamSummary summary = aggregator.aggregate(teamA, List.of());

        assertThat(summary.getTotalMatches()).isZero();
        assertThat(summary.getWinRate()).isEqualTo(0.0);
        assertThat(summary.isHasNRRData()).isFalse();
    }

    @Test
    @DisplayName("Points : 2 par victoire, 1 par nul, 0 par défaite")
    void shouldComputePointsAndWinRate() {
        InningsContribution bat = new InningsContribution(160, 5, 120);
        InningsContribution bowl = new InningsContribution(150, 7, 120);
        List<TeamMatchClassification> results = List.of(
                new TeamMatchClassification(1L, true, MatchOutcome.WIN, null, bat, bowl),
                new TeamMatchClassification(2L, true, MatchOutcome.DRAW, null, bat, bowl),
                new TeamMatchClassification(3L, true, MatchOutcome.LOSS, null, bat, bowl),
                TeamMatchClassification.skipped(4L, SkipReason.NO_RESULT),
                TeamMatchClassification.notParticipated(5L));

        TeamSummary summary = aggregator.aggregate(teamA, results);

        assertThat(summary.getTotalMatches()).isEqualTo(3);
        assertThat(summary.getWins()).isEqualTo(1);
        assertThat(summary.getDraws()).isEqualTo(1);
        assertThat(summary.getLosses()).isEqualTo(1);
        assertThat(summary.getTournamentPoints()).isEqualTo(3);
        assertThat(summary.getWinRate()).isEqualTo(33.33);
        assertThat(summary.getRunsScored()).isEqualTo(480);
        assertThat(summary.getMatchesSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Le fold incrémental donne le même cumul que le recalcul complet")
    void incrementalFoldMatchesFullRederivation() {
        TeamMatchClassification m1 = new TeamMatchClassification(1L, true, MatchOutcome.WIN, null,
                new InningsContribution(180, 4, 120), new InningsContribution(170, 9, 120));
        TeamMatchClassification m2 = new TeamMatchClassification(2L, true, MatchOutcome.LOSS, null,
                new InningsContribution(99, 10, 87), new InningsContribution(100, 2, 70));

        TeamStats incremental = aggregator.fold(aggregator.fold(null, m1), m2);
        TeamStats full = aggregator.foldAll(List.of(m1, m2));

        assertThat(incremental).isEqualTo(full);
        assertThat(full.getBallsFaced()).isEqualTo(207);
        assertThat(full.getNetRunRate()).isNotNull();
    }
}
