package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.exception.MatchAlreadyCompletedException;
import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.BatsmanEntry;
import com.tony.cricketLeague.model.BattingStats;
import com.tony.cricketLeague.model.BowlerEntry;
import com.tony.cricketLeague.model.BowlingStats;
import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.FieldingStats;
import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.MatchAwards;
import com.tony.cricketLeague.model.MatchResult;
import com.tony.cricketLeague.model.MatchStatus;
import com.tony.cricketLeague.model.PlayerPerformance;
import com.tony.cricketLeague.model.ResultSummary;
import com.tony.cricketLeague.model.ResultType;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.dto.MatchCompletionRequest;
import com.tony.cricketLeague.model.dto.MatchCompletionResult;
import com.tony.cricketLeague.repository.CricketMatchRepository;
import com.tony.cricketLeague.repository.PlayerPerformanceRepository;
import com.tony.cricketLeague.repository.TeamRepository;
import com.tony.cricketLeague.util.OversConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Clôture d'un match : scorecard final -> performances par joueur -> stats carrière -> stats d'équipe.
 * <p>
 * Le match n'est marqué terminé (et les équipes mises à jour, dans la même transaction)
 * que si tous les joueurs sont passés.
 * Rejouer la clôture après une erreur est sans risque : les joueurs déjà traités sont ignorés.
 */
@Service
@Slf4j
public class MatchCompletionService {

    private static final Set<String> CAUGHT = Set.of("caught", "caught-behind", "caught-and-bowled");
    private static final String RUN_OUT = "run-out";
    private static final String STUMPED = "stumped";

    private final CricketMatchRepository matchRepository;
    private final TeamRepository teamRepository;
    private final PlayerPerformanceRepository performanceRepository;
    private final PlayerStatsService playerStatsService;
    private final TeamStatsService teamStatsService;
    private final RankingService rankingService;
    private final LeagueStatsProperties properties;
    private final TransactionTemplate transactionTemplate;

    public MatchCompletionService(CricketMatchRepository matchRepository,
                                  TeamRepository teamRepository,
                                  PlayerPerformanceRepository performanceRepository,
                                  PlayerStatsService playerStatsService,
                                  TeamStatsService teamStatsService,
                                  RankingService rankingService,
                                  LeagueStatsProperties properties,
                                  PlatformTransactionManager transactionManager) {
        this.matchRepository = matchRepository;
        this.teamRepository = teamRepository;
        this.performanceRepository = performanceRepository;
        this.playerStatsService = playerStatsService;
        this.teamStatsService = teamStatsService;
        this.rankingService = rankingService;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public MatchCompletionResult completeMatch(Long matchId, MatchCompletionRequest request) {
        CricketMatch match = matchRepository.findById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));
        if (match.isCompleted()) {
            throw new MatchAlreadyCompletedException(matchId);
        }

        // 1. Validation complète AVANT de toucher aux stats
        Team team1 = teamRepository.findById(match.getTeam1Id())
                .orElseThrow(() -> new ResourceNotFoundException("Team", match.getTeam1Id()));
        teamRepository.findById(match.getTeam2Id())
                .orElseThrow(() -> new ResourceNotFoundException("Team", match.getTeam2Id()));
        validate(match, request);

        // 2. Scorecard et résultat enregistrés (même si des joueurs échouent ensuite)
        transactionTemplate.executeWithoutResult(status -> saveScorecard(matchId, request));

        // 3. Une performance par joueur, chacune dans sa propre transaction
        Map<Long, PlayerPerformance> performances = buildPerformances(match, request);
        int processed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (PlayerPerformance performance : performances.values()) {
            try {
                if (recordWithRetry(performance)) {
                    processed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Stats non enregistrées pour le joueur {} (match {})", performance.getPlayerId(), matchId, e);
                errors.add(String.format("Player %s: %s", performance.getPlayerId(), e.getMessage()));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("⚠️ Match {} non clôturé : {} erreur(s) sur {} joueurs", matchId, errors.size(), performances.size());
            return new MatchCompletionResult(matchId, false, processed, skipped, performances.size(), errors);
        }

        // 4. Clôture et stats d'équipe dans la même transaction : un conflit de version annule les deux
        retryOnVersionConflict("clôture du match " + matchId, () ->
                transactionTemplate.executeWithoutResult(status -> {
                    markCompleted(matchId);
                    teamStatsService.applyCompletedMatch(matchId);
                }));

        // 5. Classement (dérivé des stats d'équipe, recalculé à chaque clôture)
        try {
            retryOnVersionConflict("classement " + team1.getSport(), () -> rankingService.updateStandings(team1.getSport()));
        } catch (ObjectOptimisticLockingFailureException e) {
            log.error("❌ Classement {} non mis à jour après le match {}, il le sera à la prochaine clôture",
                    team1.getSport(), matchId, e);
        }

        log.info("🏏 Match {} clôturé : {} joueurs traités, {} déjà enregistrés", matchId, processed, skipped);
        return new MatchCompletionResult(matchId, true, processed, skipped, performances.size(), errors);
    }

    private void validate(CricketMatch match, MatchCompletionRequest request) {
        if (match.getTeam1Id() == null || match.getTeam2Id() == null || match.getTeam1Id().equals(match.getTeam2Id())) {
            throw new IllegalArgumentException("A match needs two distinct teams");
        }
        ResultSummary result = request.getResultSummary();
        if (result.getWinnerId() != null && !match.involves(result.getWinnerId())) {
            throw new IllegalArgumentException("winnerId " + result.getWinnerId() + " did not play this match");
        }
        for (Innings inning : allInnings(request)) {
            if (!match.involves(inning.getBattingTeamId())) {
                throw new IllegalArgumentException("battingTeamId " + inning.getBattingTeamId() + " did not play this match");
            }
            // Lève InvalidOversFormatException sur un "4.7"
            OversConverter.oversToBalls(inning.getTotalOvers());
            for (BowlerEntry bowler : inning.getBowlers()) {
                OversConverter.oversToBalls(bowler.getOvers());
            }
        }
    }

    private void saveScorecard(Long matchId, MatchCompletionRequest request) {
        CricketMatch match = matchRepository.findById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));
        if (match.isCompleted()) {
            throw new MatchAlreadyCompletedException(matchId);
        }
        match.replaceScorecard(
                request.getTeam1Innings() != null ? request.getTeam1Innings() : List.of(),
                request.getTeam2Innings() != null ? request.getTeam2Innings() : List.of());
        match.setResultSummary(request.getResultSummary());
        match.setAwards(request.getAwards());
        matchRepository.save(match);
    }

    private void markCompleted(Long matchId) {
        CricketMatch match = matchRepository.findById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));
        if (match.isCompleted()) {
            throw new MatchAlreadyCompletedException(matchId);
        }
        match.setStatus(MatchStatus.COMPLETED);
        matchRepository.save(match);
    }

    /**
     * Batteurs -> équipe qui bat, lanceurs -> équipe qui lance,
     * fielding déduit des éliminations (caught / run-out / stumped) avec un fielder renseigné.
     */
    Map<Long, PlayerPerformance> buildPerformances(CricketMatch match, MatchCompletionRequest request) {
        Map<Long, PlayerPerformance> performances = new LinkedHashMap<>();
        MatchAwards awards = request.getAwards() != null ? request.getAwards() : new MatchAwards();

        for (Innings inning : allInnings(request)) {
            Long battingTeam = inning.getBattingTeamId();
            Long fieldingTeam = match.opponentOf(battingTeam);

            for (BatsmanEntry batsman : inning.getBatsmen()) {
                if (batsman.getPlayerId() == null) continue;
                PlayerPerformance perf = performanceFor(performances, match, request, batsman.getPlayerId(), battingTeam);
                addBatting(perf, batsman);

                if (batsman.isDismissed() && batsman.getFielderId() != null && batsman.getDismissalType() != null) {
                    String dismissal = batsman.getDismissalType().trim().toLowerCase();
                    if (CAUGHT.contains(dismissal) || RUN_OUT.equals(dismissal) || STUMPED.equals(dismissal)) {
                        PlayerPerformance fielder = performanceFor(performances, match, request, batsman.getFielderId(), fieldingTeam);
                        FieldingStats fielding = fielder.getFieldingStats();
                        if (RUN_OUT.equals(dismissal)) {
                            fielding.setRunOuts(fielding.getRunOuts() + 1);
                        } else if (STUMPED.equals(dismissal)) {
                            fielding.setStumpings(fielding.getStumpings() + 1);
                        } else {
                            fielding.setCatches(fielding.getCatches() + 1);
                        }
                    }
                }
            }

            for (BowlerEntry bowler : inning.getBowlers()) {
                if (bowler.getPlayerId() == null) continue;
                PlayerPerformance perf = performanceFor(performances, match, request, bowler.getPlayerId(), fieldingTeam);
                addBowling(perf, bowler);
            }
        }

        performances.values().forEach(p -> p.setAwards(awards.awardsFor(p.getPlayerId())));
        return performances;
    }

    private PlayerPerformance performanceFor(Map<Long, PlayerPerformance> performances, CricketMatch match,
                                             MatchCompletionRequest request, Long playerId, Long teamId) {
        return performances.computeIfAbsent(playerId, id -> {
            PlayerPerformance perf = new PlayerPerformance(match.getId(), id, teamId);
            perf.setOpposition(match.nameOf(match.opponentOf(teamId)));
            perf.setVenue(match.getVenue());
            perf.setMatchDate(match.getMatchDate());
            perf.setMatchResult(resultFor(request.getResultSummary(), teamId));
            return perf;
        });
    }

    // Plusieurs manches (format deux manches) : les lignes d'un même joueur sont cumulées
    private void addBatting(PlayerPerformance perf, BatsmanEntry batsman) {
        BattingStats batting = perf.getBattingStats();
        if (batting == null) {
            batting = new BattingStats(0, 0, 0, 0, false, null);
            perf.setBattingStats(batting);
        }
        batting.setRuns(batting.runsOrZero() + orZero(batsman.getRunsScored()));
        batting.setBalls(batting.ballsOrZero() + orZero(batsman.getBallsFaced()));
        batting.setFours(orZero(batting.getFours()) + orZero(batsman.getFours()));
        batting.setSixes(orZero(batting.getSixes()) + orZero(batsman.getSixes()));
        if (batsman.isDismissed()) {
            batting.setDismissed(true);
            batting.setDismissalType(batsman.getDismissalType());
        } else if (batting.getDismissalType() == null) {
            batting.setDismissalType("not-out");
        }
    }

    private void addBowling(PlayerPerformance perf, BowlerEntry bowler) {
        BowlingStats bowling = perf.getBowlingStats();
        if (bowling == null) {
            bowling = new BowlingStats(0.0, 0, 0, 0);
            perf.setBowlingStats(bowling);
        }
        // Addition en balles : 3.4 + 2.4 = 6.2
        bowling.setOvers(OversConverter.ballsToOvers(bowling.ballsBowled() + OversConverter.oversToBalls(bowler.getOvers())));
        bowling.setMaidens(bowling.maidensOrZero() + orZero(bowler.getMaidens()));
        bowling.setRuns(bowling.runsOrZero() + orZero(bowler.getRunsGiven()));
        bowling.setWickets(bowling.wicketsOrZero() + orZero(bowler.getWickets()));
    }

    static MatchResult resultFor(ResultSummary result, Long teamId) {
        if (result == null) return MatchResult.NO_RESULT;
        if (result.getResultType() == ResultType.TIED) return MatchResult.TIED;
        if (result.getWinnerId() != null) {
            return result.getWinnerId().equals(teamId) ? MatchResult.WON : MatchResult.LOST;
        }
        return MatchResult.NO_RESULT;
    }

    /**
     * @return false si la performance était déjà enregistrée
     */
    private boolean recordWithRetry(PlayerPerformance performance) {
        int attempt = 1;
        while (true) {
            try {
                return playerStatsService.recordPerformance(performance);
            } catch (ObjectOptimisticLockingFailureException e) {
                // Clôture concurrente sur le même joueur : on relit et on recommence
                if (attempt >= properties.getMaxAccumulationRetries()) {
                    throw e;
                }
                log.warn("🔁 Conflit de version sur le joueur {}, tentative {}/{}",
                        performance.getPlayerId(), attempt + 1, properties.getMaxAccumulationRetries());
                attempt++;
                performance.setId(null);
            } catch (DataIntegrityViolationException e) {
                // La contrainte unique (match, joueur) a tranché : un appel concurrent a enregistré
                if (performanceRepository.existsByMatchIdAndPlayerId(performance.getMatchId(), performance.getPlayerId())) {
                    return false;
                }
                throw e;
            }
        }
    }

    private void retryOnVersionConflict(String operation, Runnable action) {
        int attempt = 1;
        while (true) {
            try {
                action.run();
                return;
            } catch (ObjectOptimisticLockingFailureException e) {
                if (attempt >= properties.getMaxAccumulationRetries()) {
                    throw e;
                }
                attempt++;
                log.warn("🔁 Conflit de version ({}), tentative {}/{}",
                        operation, attempt, properties.getMaxAccumulationRetries());
            }
        }
    }

    private static List<Innings> allInnings(MatchCompletionRequest request) {
        List<Innings> innings = new ArrayList<>();
        if (request.getTeam1Innings() != null) innings.addAll(request.getTeam1Innings());
        if (request.getTeam2Innings() != null) innings.addAll(request.getTeam2Innings());
        return innings;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
