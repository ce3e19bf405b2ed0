package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.model.ReferenceRewriteTask;
import com.tony.cricketLeague.model.RewriteTaskStatus;
import com.tony.cricketLeague.model.dto.RewriteReport;
import com.tony.cricketLeague.repository.ReferenceRewriteTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceRepairServiceTest {

    @Mock
    private ReferenceRewriteTaskRepository taskRepository;

    @Mock
    private PlayerReferenceRewriter rewriter;

    @Mock
    private PlayerStatsService playerStatsService;

    private LeagueStatsProperties properties;
    private ReferenceRepairService repairService;

    @BeforeEach
    void setUp() {
        properties = new LeagueStatsProperties();
        properties.setRepairMaxAttempts(2);
        repairService = new ReferenceRepairService(taskRepository, rewriter, playerStatsService, properties);
    }

    @Test
    void enqueue_ShouldRecordFailedCollections() {
        RewriteReport report = new RewriteReport(2L, 1L);
        report.getFailures().put("scorecards", "lock timeout");
        report.getFailures().put("matchAwards", "lock timeout");
        when(taskRepository.save(any(ReferenceRewriteTask.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReferenceRewriteTask task = repairService.enqueue(report, false, true);

        assertThat(task.getStatus()).isEqualTo(RewriteTaskStatus.PENDING);
        assertThat(task.getFailedCollections()).isEqualTo("scorecards,matchAwards");
        assertThat(task.getLastError()).contains("scorecards: lock timeout");
        assertThat(task.isSourceDeletionPending()).isFalse();
        assertThat(task.isCareerRebuildPending()).isTrue();
    }

    @Test
    void processPending_CompleteRewriteShouldDeleteSourceAndCloseTask() {
        ReferenceRewriteTask task = new ReferenceRewriteTask(2L, 1L);
        task.setSourceDeletionPending(true);
        when(taskRepository.findByStatusOrderByCreatedAtAsc(RewriteTaskStatus.PENDING)).thenReturn(List.of(task));
        when(rewriter.rewrite(2L, 1L)).thenReturn(new RewriteReport(2L, 1L));
        when(rewriter.deleteSourceIfUnreferenced(2L)).thenReturn(true);

        int repaired = repairService.processPending();

        assertThat(repaired).isEqualTo(1);
        assertThat(task.getStatus()).isEqualTo(RewriteTaskStatus.DONE);
        assertThat(task.isSourceDeletionPending()).isFalse();
        assertThat(task.getAttempts()).isEqualTo(1);
        verify(taskRepository).save(task);
        verifyNoInteractions(playerStatsService);
    }

    @Test
    void process_ShouldRebuildCareerOncePerformancesAreMoved() {
        ReferenceRewriteTask task = new ReferenceRewriteTask(2L, 1L);
        task.setCareerRebuildPending(true);
        when(rewriter.rewrite(2L, 1L)).thenReturn(new RewriteReport(2L, 1L));

        boolean done = repairService.process(task);

        assertThat(done).isTrue();
        assertThat(task.isCareerRebuildPending()).isFalse();
        verify(playerStatsService).rebuildCareerStats(1L);
    }

    @Test
    void process_FailedRebuildShouldKeepTaskPending() {
        ReferenceRewriteTask task = new ReferenceRewriteTask(2L, 1L);
        task.setCareerRebuildPending(true);
        when(rewriter.rewrite(2L, 1L)).thenReturn(new RewriteReport(2L, 1L));
        when(playerStatsService.rebuildCareerStats(1L)).thenThrow(new IllegalStateException("version conflict"));

        boolean done = repairService.process(task);

        assertThat(done).isFalse();
        assertThat(task.getStatus()).isEqualTo(RewriteTaskStatus.PENDING);
        assertThat(task.isCareerRebuildPending()).isTrue();
        assertThat(task.getFailedCollections()).isEqualTo("careerStats");
    }

    @Test
    void process_ShouldGiveUpAfterMaxAttempts() {
        ReferenceRewriteTask task = new ReferenceRewriteTask(2L, 1L);
        task.setAttempts(1);
        RewriteReport report = new RewriteReport(2L, 1L);
        report.getFailures().put("teamRosters", "deadlock");
        when(rewriter.rewrite(2L, 1L)).thenReturn(report);

        boolean done = repairService.process(task);

        assertThat(done).isFalse();
        assertThat(task.getStatus()).isEqualTo(RewriteTaskStatus.FAILED);
        assertThat(task.getFailedCollections()).isEqualTo("teamRosters");
        verify(rewriter, never()).deleteSourceIfUnreferenced(any());
    }
}
