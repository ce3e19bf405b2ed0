package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.PlayerPerformance;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.dto.RewriteReport;
import com.tony.cricketLeague.repository.CricketMatchRepository;
import com.tony.cricketLeague.repository.InningsRepository;
import com.tony.cricketLeague.repository.MatchRosterEntryRepository;
import com.tony.cricketLeague.repository.PlayerPerformanceRepository;
import com.tony.cricketLeague.repository.PlayerRepository;
import com.tony.cricketLeague.repository.TeamRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.IntSupplier;

/**
 * Redirige toutes les références d'un ancien joueur vers un nouveau.
 * Chaque collection est une étape indépendante avec sa propre transaction :
 * l'échec de l'une n'annule pas les autres, il est consigné dans le {@link RewriteReport}.
 */
@Service
@Slf4j
public class PlayerReferenceRewriter {

    public static final String PERFORMANCES = "performances";
    public static final String TEAM_ROSTERS = "teamRosters";
    public static final String MATCH_ROSTER = "matchRoster";
    public static final String SCORECARDS = "scorecards";
    public static final String MATCH_AWARDS = "matchAwards";

    private final PlayerRepository playerRepository;
    private final PlayerPerformanceRepository performanceRepository;
    private final TeamRepository teamRepository;
    private final MatchRosterEntryRepository rosterRepository;
    private final InningsRepository inningsRepository;
    private final CricketMatchRepository matchRepository;
    private final TransactionTemplate transactionTemplate;

    public PlayerReferenceRewriter(PlayerRepository playerRepository,
                                   PlayerPerformanceRepository performanceRepository,
                                   TeamRepository teamRepository,
                                   MatchRosterEntryRepository rosterRepository,
                                   InningsRepository inningsRepository,
                                   CricketMatchRepository matchRepository,
                                   PlatformTransactionManager transactionManager) {
        this.playerRepository = playerRepository;
        this.performanceRepository = performanceRepository;
        this.teamRepository = teamRepository;
        this.rosterRepository = rosterRepository;
        this.inningsRepository = inningsRepository;
        this.matchRepository = matchRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public RewriteReport rewrite(Long oldPlayerId, Long newPlayerId) {
        RewriteReport report = new RewriteReport(oldPlayerId, newPlayerId);

        step(report, PERFORMANCES, () -> rewritePerformances(oldPlayerId, newPlayerId));
        step(report, TEAM_ROSTERS, () -> rewriteTeamRosters(oldPlayerId, newPlayerId));
        step(report, MATCH_ROSTER, () -> rosterRepository.reassignPlayer(oldPlayerId, newPlayerId));
        step(report, SCORECARDS, () -> rewriteScorecards(oldPlayerId, newPlayerId));
        step(report, MATCH_AWARDS, () -> rewriteAwards(oldPlayerId, newPlayerId));

        if (report.isComplete()) {
            log.info("✅ Références {} -> {} réécrites ({})", oldPlayerId, newPlayerId, report.getCollectionsUpdated());
        } else {
            log.warn("⚠️ Réécriture {} -> {} incomplète, échecs : {}", oldPlayerId, newPlayerId, report.getFailures().keySet());
        }
        return report;
    }

    /**
     * Supprime l'ancien joueur s'il n'a plus aucune performance rattachée.
     */
    public boolean deleteSourceIfUnreferenced(Long sourcePlayerId) {
        Boolean deleted = transactionTemplate.execute(status -> {
            if (!playerRepository.existsById(sourcePlayerId)) {
                return true;
            }
            if (performanceRepository.countByPlayerId(sourcePlayerId) > 0) {
                return false;
            }
            playerRepository.deleteById(sourcePlayerId);
            return true;
        });
        if (Boolean.TRUE.equals(deleted)) {
            log.info("🗑️ Joueur source {} supprimé après fusion", sourcePlayerId);
        }
        return Boolean.TRUE.equals(deleted);
    }

    private void step(RewriteReport report, String collection, IntSupplier update) {
        try {
            Integer updated = transactionTemplate.execute(status -> update.getAsInt());
            report.getCollectionsUpdated().add(collection);
            log.debug("   -> {} : {} ligne(s) mise(s) à jour", collection, updated);
        } catch (RuntimeException e) {
            log.error("❌ Réécriture de '{}' échouée ({} -> {})", collection,
                    report.getOldPlayerId(), report.getNewPlayerId(), e);
            report.getFailures().put(collection, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private int rewritePerformances(Long oldId, Long newId) {
        int moved = performanceRepository.reassignPlayer(oldId, newId);

        // Reste : matchs où le joueur cible a déjà sa propre ligne (doublon du même match)
        List<PlayerPerformance> duplicates = performanceRepository.findByPlayerIdOrderByMatchDateDesc(oldId);
        if (!duplicates.isEmpty()) {
            performanceRepository.deleteAll(duplicates);
            log.info("🧹 {} performance(s) en doublon supprimée(s) pour le joueur {}", duplicates.size(), oldId);
        }
        return moved;
    }

    private int rewriteTeamRosters(Long oldId, Long newId) {
        List<Team> teams = teamRepository.findByRosterPlayer(oldId);
        for (Team team : teams) {
            List<Long> roster = team.getPlayerIds();
            if (roster.contains(newId)) {
                roster.removeIf(oldId::equals);
            } else {
                roster.replaceAll(id -> oldId.equals(id) ? newId : id);
            }
        }
        teamRepository.saveAll(teams);
        return teams.size();
    }

    private int rewriteScorecards(Long oldId, Long newId) {
        List<Innings> innings = inningsRepository.findReferencingPlayer(oldId);
        innings.forEach(i -> i.replacePlayer(oldId, newId));
        inningsRepository.saveAll(innings);
        return innings.size();
    }

    private int rewriteAwards(Long oldId, Long newId) {
        List<CricketMatch> matches = matchRepository.findByAwardedPlayer(oldId);
        matches.forEach(m -> m.getAwards().replacePlayer(oldId, newId));
        matchRepository.saveAll(matches);
        return matches.size();
    }
}
