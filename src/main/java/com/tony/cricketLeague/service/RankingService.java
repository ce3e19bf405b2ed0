package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final TeamRepository teamRepository;
    private final TeamStatsAggregator aggregator;

    /**
     * Calcule et enregistre le classement de toutes les équipes d'un sport.
     * Doit être appelé APRÈS la mise à jour des stats d'équipe (TeamStatsService).
     */
    @Transactional
    public List<TeamSummary> updateStandings(String sport) {
        List<Team> teams = sortedTeams(sport);
        if (teams.isEmpty()) return List.of();

        // Assigner le rang officiel (les équipes sans stats restent sans rang)
        int rank = 1;
        for (Team team : teams) {
            if (team.getCurrentStats() != null) {
                team.getCurrentStats().setStandingPosition(rank++);
            }
        }

        teamRepository.saveAll(teams);
        log.info("🏆 Classement généré et mis à jour pour le sport {}", sport);
        return teams.stream().map(t -> aggregator.summarize(t, t.getCurrentStats())).toList();
    }

    /**
     * Classement en lecture seule, dans l'ordre officiel.
     */
    @Transactional(readOnly = true)
    public List<TeamSummary> getStandings(String sport) {
        List<TeamSummary> standings = new ArrayList<>();
        int rank = 1;
        for (Team team : sortedTeams(sport)) {
            TeamSummary summary = aggregator.summarize(team, team.getCurrentStats());
            summary.setStandingPosition(team.getCurrentStats() != null ? rank++ : null);
            standings.add(summary);
        }
        return standings;
    }

    private List<Team> sortedTeams(String sport) {
        List<Team> teams = new ArrayList<>(teamRepository.findBySportIgnoreCase(sport));
        teams.sort(STANDINGS_ORDER);
        return teams;
    }

    // Points (Desc) -> NRR (Desc, sans NRR en dernier) -> Victoires (Desc)
    static final Comparator<Team> STANDINGS_ORDER = (t1, t2) -> {
        TeamStats stats1 = t1.getCurrentStats();
        TeamStats stats2 = t2.getCurrentStats();

        // Les équipes sans stats finissent en bas
        if (stats1 == null && stats2 == null) return 0;
        if (stats1 == null) return 1;
        if (stats2 == null) return -1;

        // Critère 1 : Points
        if (stats1.getTournamentPoints() != stats2.getTournamentPoints()) {
            return Integer.compare(stats2.getTournamentPoints(), stats1.getTournamentPoints());
        }

        // Critère 2 : Net Run Rate
        Double nrr1 = stats1.getNetRunRate();
        Double nrr2 = stats2.getNetRunRate();
        if (nrr1 != null && nrr2 == null) return -1;
        if (nrr1 == null && nrr2 != null) return 1;
        if (nrr1 != null && !nrr1.equals(nrr2)) {
            return Double.compare(nrr2, nrr1);
        }

        // Critère 3 : Victoires
        return Integer.compare(stats2.getWins(), stats1.getWins());
    };
}
