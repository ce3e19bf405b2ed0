package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.InningsContribution;
import com.tony.cricketLeague.model.dto.TeamMatchClassification;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.util.OversConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Agrège les classifications de matchs d'une équipe en bilan (V/D/N, points, NRR).
 * Le même {@link #fold} sert à la mise à jour incrémentale et au recalcul complet.
 */
@Component
@RequiredArgsConstructor
public class TeamStatsAggregator {

    private final LeagueStatsProperties properties;

    /**
     * Ajoute un match classé au cumul. Les matchs ignorés (SKIP) ne touchent ni le bilan ni le NRR.
     */
    public TeamStats fold(TeamStats current, TeamMatchClassification classification) {
        TeamStats stats = current != null ? current.toBuilder().build() : new TeamStats();
        if (!classification.isParticipated()) {
            return stats;
        }
        if (!classification.counts()) {
            stats.setMatchesSkipped(stats.getMatchesSkipped() + 1);
            return stats;
        }

        switch (classification.getOutcome()) {
            case WIN -> stats.setWins(stats.getWins() + 1);
            case LOSS -> stats.setLosses(stats.getLosses() + 1);
            case DRAW -> stats.setDraws(stats.getDraws() + 1);
            default -> { }
        }
        stats.setTotalMatches(stats.getWins() + stats.getLosses() + stats.getDraws());
        stats.setTournamentPoints(points(stats.getWins(), stats.getDraws()));

        InningsContribution batting = classification.getBattingContribution();
        stats.setRunsScored(stats.getRunsScored() + batting.getRuns());
        stats.setWicketsLost(stats.getWicketsLost() + batting.getWickets());
        stats.setBallsFaced(stats.getBallsFaced() + batting.getBalls());

        InningsContribution bowling = classification.getBowlingContribution();
        stats.setRunsConceded(stats.getRunsConceded() + bowling.getRuns());
        stats.setWicketsTaken(stats.getWicketsTaken() + bowling.getWickets());
        stats.setBallsBowled(stats.getBallsBowled() + bowling.getBalls());

        stats.setNetRunRate(netRunRate(stats));
        return stats;
    }

    public TeamStats foldAll(List<TeamMatchClassification> classifications) {
        TeamStats stats = new TeamStats();
        for (TeamMatchClassification classification : classifications) {
            stats = fold(stats, classification);
        }
        return stats;
    }

    /**
     * Vue de lecture d'un cumul : taux de victoire et NRR (retenu si les données de balles manquent).
     */
    public TeamSummary summarize(Team team, TeamStats stats) {
        TeamStats s = stats != null ? stats : new TeamStats();
        int total = s.getWins() + s.getLosses() + s.getDraws();
        Double nrr = netRunRate(s);

        return TeamSummary.builder()
                .teamId(team.getId())
                .teamName(team.getName())
                .standingPosition(s.getStandingPosition())
                .totalMatches(total)
                .wins(s.getWins())
                .losses(s.getLosses())
                .draws(s.getDraws())
                .winRate(total > 0 ? round2((double) s.getWins() / total * 100) : 0.0)
                .tournamentPoints(points(s.getWins(), s.getDraws()))
                .runsScored(s.getRunsScored())
                .runsConceded(s.getRunsConceded())
                .wicketsTaken(s.getWicketsTaken())
                .wicketsLost(s.getWicketsLost())
                .ballsFaced(s.getBallsFaced())
                .ballsBowled(s.getBallsBowled())
                .hasNRRData(nrr != null)
                .netRunRate(nrr)
                .matchesSkipped(s.getMatchesSkipped())
                .build();
    }

    public TeamSummary aggregate(Team team, List<TeamMatchClassification> classifications) {
        return summarize(team, foldAll(classifications));
    }

    // null si l'équipe n'a jamais batté ou jamais lancé : pas de 0.000 trompeur
    Double netRunRate(TeamStats stats) {
        if (stats.getBallsFaced() <= 0 || stats.getBallsBowled() <= 0) {
            return null;
        }
        double scoredPerOver = stats.getRunsScored() / (stats.getBallsFaced() / (double) OversConverter.BALLS_PER_OVER);
        double concededPerOver = stats.getRunsConceded() / (stats.getBallsBowled() / (double) OversConverter.BALLS_PER_OVER);
        return BigDecimal.valueOf(scoredPerOver - concededPerOver)
                .setScale(properties.getNrrScale(), RoundingMode.HALF_UP)
                .doubleValue();
    }

    private int points(int wins, int draws) {
        return wins * properties.getPointsPerWin() + draws * properties.getPointsPerDraw();
    }

    private static double round2(double val) {
        return Math.round(val * 100.0) / 100.0;
    }
}
