package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.model.ReferenceRewriteTask;
import com.tony.cricketLeague.model.RewriteTaskStatus;
import com.tony.cricketLeague.model.dto.RewriteReport;
import com.tony.cricketLeague.repository.ReferenceRewriteTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * File de réparation durable des réécritures de références incomplètes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceRepairService {

    static final String CAREER_STATS = "careerStats";

    private final ReferenceRewriteTaskRepository taskRepository;
    private final PlayerReferenceRewriter rewriter;
    private final PlayerStatsService playerStatsService;
    private final LeagueStatsProperties properties;

    public ReferenceRewriteTask enqueue(RewriteReport report, boolean sourceDeletionPending, boolean careerRebuildPending) {
        ReferenceRewriteTask task = new ReferenceRewriteTask(report.getOldPlayerId(), report.getNewPlayerId());
        task.setSourceDeletionPending(sourceDeletionPending);
        task.setCareerRebuildPending(careerRebuildPending);
        recordFailures(task, report);
        ReferenceRewriteTask saved = taskRepository.save(task);
        log.warn("📝 Tâche de réparation #{} créée ({} -> {}, échecs : {})",
                saved.getId(), report.getOldPlayerId(), report.getNewPlayerId(), saved.getFailedCollections());
        return saved;
    }

    /**
     * Rejoue toutes les tâches en attente.
     *
     * @return nombre de tâches terminées lors de ce passage
     */
    public int processPending() {
        List<ReferenceRewriteTask> pending = taskRepository.findByStatusOrderByCreatedAtAsc(RewriteTaskStatus.PENDING);
        if (pending.isEmpty()) return 0;

        log.info("🔧 {} tâche(s) de réparation en attente", pending.size());
        int done = 0;
        for (ReferenceRewriteTask task : pending) {
            if (process(task)) done++;
        }
        return done;
    }

    public boolean process(ReferenceRewriteTask task) {
        task.setAttempts(task.getAttempts() + 1);
        RewriteReport report = rewriter.rewrite(task.getOldPlayerId(), task.getNewPlayerId());

        if (task.isCareerRebuildPending() && !report.hasFailed(PlayerReferenceRewriter.PERFORMANCES)) {
            try {
                playerStatsService.rebuildCareerStats(task.getNewPlayerId());
                task.setCareerRebuildPending(false);
            } catch (RuntimeException e) {
                log.error("❌ Recalcul de carrière échoué pour le joueur {}", task.getNewPlayerId(), e);
                report.getFailures().put(CAREER_STATS, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        boolean sourceGone = !task.isSourceDeletionPending()
                || (!report.hasFailed(PlayerReferenceRewriter.PERFORMANCES)
                && rewriter.deleteSourceIfUnreferenced(task.getOldPlayerId()));

        if (report.isComplete() && sourceGone && !task.isCareerRebuildPending()) {
            task.setStatus(RewriteTaskStatus.DONE);
            task.setSourceDeletionPending(false);
            task.setFailedCollections(null);
            task.setLastError(null);
            log.info("✅ Tâche #{} réparée après {} tentative(s)", task.getId(), task.getAttempts());
        } else {
            recordFailures(task, report);
            if (task.getAttempts() >= properties.getRepairMaxAttempts()) {
                task.setStatus(RewriteTaskStatus.FAILED);
                log.error("❌ Tâche #{} abandonnée après {} tentatives : {}",
                        task.getId(), task.getAttempts(), task.getLastError());
            }
        }
        taskRepository.save(task);
        return task.getStatus() == RewriteTaskStatus.DONE;
    }

    private void recordFailures(ReferenceRewriteTask task, RewriteReport report) {
        Map<String, String> failures = report.getFailures();
        task.setFailedCollections(failures.isEmpty() ? null : String.join(",", failures.keySet()));
        task.setLastError(failures.isEmpty() ? "source player still referenced" : truncate(
                failures.entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining("; "))));
    }

    private static String truncate(String value) {
        return value.length() > 2048 ? value.substring(0, 2048) : value;
    }
}
