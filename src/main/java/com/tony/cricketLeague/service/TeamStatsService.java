package com.tony.cricketLeague.service;

import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.MatchStatus;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.TeamMatchClassification;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.repository.CricketMatchRepository;
import com.tony.cricketLeague.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamStatsService {

    private final TeamRepository teamRepository;
    private final CricketMatchRepository matchRepository;
    private final TeamResultClassifier classifier;
    private final TeamStatsAggregator aggregator;

    /**
     * Bilan courant d'une équipe (cumul stocké, taux et NRR calculés à la lecture).
     */
    @Transactional(readOnly = true)
    public TeamSummary getTeamSummary(Long teamId) {
        Team team = findTeam(teamId);
        return aggregator.summarize(team, team.getCurrentStats());
    }

    /**
     * Recalcule TOUTES les stats d'une équipe depuis l'historique des matchs terminés.
     * À appeler après une correction de données ou un import.
     */
    @Transactional
    public TeamSummary recalculateTeamStats(Long teamId) {
        Team team = findTeam(teamId);

        List<CricketMatch> matches = matchRepository.findByTeamAndStatus(teamId, MatchStatus.COMPLETED);
        List<TeamMatchClassification> classifications = matches.stream()
                .map(m -> classifier.classify(m, teamId))
                .toList();

        TeamStats stats = aggregator.foldAll(classifications);

        // Le rang dépend des autres équipes : conservé tel quel, recalculé par RankingService
        if (team.getCurrentStats() != null) {
            stats.setStandingPosition(team.getCurrentStats().getStandingPosition());
        }
        team.setCurrentStats(stats);
        teamRepository.save(team);

        log.info("✅ Stats recalculées pour : {} ({} Pts, {} MJ, {} ignorés)",
                team.getName(), stats.getTournamentPoints(), stats.getTotalMatches(), stats.getMatchesSkipped());
        return aggregator.summarize(team, stats);
    }

    /**
     * Mise à jour incrémentale des deux équipes après la clôture d'un match.
     */
    @Transactional
    public void applyCompletedMatch(Long matchId) {
        CricketMatch match = matchRepository.findById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));

        for (Long teamId : List.of(match.getTeam1Id(), match.getTeam2Id())) {
            Team team = findTeam(teamId);
            TeamMatchClassification classification = classifier.classify(match, teamId);
            team.setCurrentStats(aggregator.fold(team.getCurrentStats(), classification));
            teamRepository.save(team);
            log.info("📈 {} : match {} classé {}", team.getName(), matchId,
                    classification.getOutcome() != null ? classification.getOutcome() : classification.getSkipReason());
        }
    }

    /**
     * Recalcul complet de toutes les équipes (commande d'administration).
     */
    @Transactional
    public int recalculateAll() {
        List<Team> teams = teamRepository.findAll();
        teams.forEach(t -> recalculateTeamStats(t.getId()));
        return teams.size();
    }

    private Team findTeam(Long teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
    }
}
