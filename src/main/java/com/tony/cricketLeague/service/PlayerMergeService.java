package com.tony.cricketLeague.service;

import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.CareerStats;
import com.tony.cricketLeague.model.FieldChoice;
import com.tony.cricketLeague.model.MergeHistoryEntry;
import com.tony.cricketLeague.model.MergeWarning;
import com.tony.cricketLeague.model.Player;
import com.tony.cricketLeague.model.PlayerField;
import com.tony.cricketLeague.model.ReferenceRewriteTask;
import com.tony.cricketLeague.model.dto.MergeRequest;
import com.tony.cricketLeague.model.dto.MergeResult;
import com.tony.cricketLeague.model.dto.PlayerRequest;
import com.tony.cricketLeague.model.dto.RewriteReport;
import com.tony.cricketLeague.repository.PlayerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fusion d'un joueur source dans un joueur cible.
 * <ol>
 *   <li>Résolution des champs, committée seule (le choix de l'utilisateur n'est jamais perdu).</li>
 *   <li>Réécriture des références source -> cible, collection par collection.</li>
 *   <li>Carrière recalculée depuis les performances si les deux carrières ont été additionnées.</li>
 *   <li>Suppression de la source, ou tâche de réparation si la réécriture est incomplète.</li>
 * </ol>
 */
@Service
@Slf4j
public class PlayerMergeService {

    private final PlayerRepository playerRepository;
    private final CareerStatsAccumulator accumulator;
    private final PlayerReferenceRewriter referenceRewriter;
    private final ReferenceRepairService repairService;
    private final PlayerStatsService playerStatsService;
    private final TransactionTemplate transactionTemplate;

    public PlayerMergeService(PlayerRepository playerRepository,
                              CareerStatsAccumulator accumulator,
                              PlayerReferenceRewriter referenceRewriter,
                              ReferenceRepairService repairService,
                              PlayerStatsService playerStatsService,
                              PlatformTransactionManager transactionManager) {
        this.playerRepository = playerRepository;
        this.accumulator = accumulator;
        this.referenceRewriter = referenceRewriter;
        this.repairService = repairService;
        this.playerStatsService = playerStatsService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public MergeResult merge(MergeRequest request) {
        Long targetId = request.getTargetPlayerId();
        Long sourceId = request.getSourcePlayerId();

        if (sourceId == null && request.getCandidate() == null) {
            throw new IllegalArgumentException("Either sourcePlayerId or candidate data is required");
        }
        if (targetId.equals(sourceId)) {
            throw new IllegalArgumentException("Cannot merge a player with itself");
        }

        log.info("🔀 Fusion du joueur {} dans le joueur {}", sourceId != null ? sourceId : "(candidat)", targetId);

        // 1. Fusion des champs (transaction courte, committée avant toute réécriture)
        FieldMerge fieldMerge = transactionTemplate.execute(status -> mergeFields(request));

        if (sourceId == null) {
            // Candidat jamais enregistré : aucune référence à réécrire
            return new MergeResult(fieldMerge.player, fieldMerge.mergedFields, fieldMerge.statsCombined,
                    false, null, List.of(), null);
        }

        // 2. Réécriture des références (échec partiel toléré, jamais de rollback de l'étape 1)
        RewriteReport report = referenceRewriter.rewrite(sourceId, targetId);

        boolean performancesMoved = !report.hasFailed(PlayerReferenceRewriter.PERFORMANCES);

        // 3. Carrières additionnées : recalcul depuis les performances (un match joué par les deux ne compte qu'une fois)
        boolean careerRebuildPending = fieldMerge.statsCombined;
        if (fieldMerge.statsCombined && performancesMoved) {
            try {
                fieldMerge.player.setCareerStats(playerStatsService.rebuildCareerStats(targetId));
                careerRebuildPending = false;
            } catch (RuntimeException e) {
                // Laissé à la file de réparation
                log.error("❌ Recalcul de carrière échoué pour le joueur {} après fusion", targetId, e);
                report.getFailures().put(ReferenceRepairService.CAREER_STATS,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        // 4. Suppression de la source une fois ses performances rattachées à la cible
        boolean sourceDeleted = performancesMoved && referenceRewriter.deleteSourceIfUnreferenced(sourceId);

        List<MergeWarning> warnings = new ArrayList<>();
        Long repairTaskId = null;
        if (!report.isComplete() || !sourceDeleted) {
            warnings.add(MergeWarning.REFERENCE_REWRITE_INCOMPLETE);
            ReferenceRewriteTask task = repairService.enqueue(report, !sourceDeleted, careerRebuildPending);
            repairTaskId = task.getId();
        }

        return new MergeResult(fieldMerge.player, fieldMerge.mergedFields, fieldMerge.statsCombined,
                sourceDeleted, report, warnings, repairTaskId);
    }

    private FieldMerge mergeFields(MergeRequest request) {
        Player target = playerRepository.findById(request.getTargetPlayerId())
                .orElseThrow(() -> new ResourceNotFoundException("Target player", request.getTargetPlayerId()));

        Player source = null;
        PlayerRequest candidate = request.getCandidate();
        if (request.getSourcePlayerId() != null) {
            source = playerRepository.findById(request.getSourcePlayerId())
                    .orElseThrow(() -> new ResourceNotFoundException("Source player", request.getSourcePlayerId()));
            candidate = toRequest(source);
        }

        // Lien utilisateur : au plus un joueur par compte
        if (source != null && source.getUserId() != null && target.getUserId() != null
                && !source.getUserId().equals(target.getUserId())) {
            throw new IllegalStateException(String.format(
                    "Players %s and %s are linked to different user accounts", target.getId(), source.getId()));
        }

        List<String> mergedFields = resolveFields(target, candidate, request.getFieldResolutions());

        if (source != null && source.getUserId() != null && target.getUserId() == null) {
            target.setUserId(source.getUserId());
            source.setUserId(null);
            mergedFields.add("userId");
        }

        boolean combine = shouldCombine(request.getCombineCareerStats(), source);
        if (combine) {
            target.setCareerStats(accumulator.combine(target.getCareerStats(), source.getCareerStats()));
        }

        if (source != null) {
            target.getMergedFromPlayerIds().add(source.getId());
            target.getMergeHistory().add(new MergeHistoryEntry(Instant.now(), source.getId(),
                    request.getMergedBy(), String.join(",", mergedFields)));
        }

        Player saved = playerRepository.save(target);
        log.info("✅ Champs fusionnés sur le joueur {} : {} (stats cumulées : {})", saved.getId(), mergedFields, combine);
        return new FieldMerge(saved, mergedFields, combine);
    }

    /**
     * Champs contestés : valeur choisie (par défaut celle de l'existant).
     * Champ vide côté existant : complété par le candidat. Email et id jamais écrasés.
     */
    List<String> resolveFields(Player target, PlayerRequest candidate, Map<String, FieldChoice> resolutions) {
        List<String> mergedFields = new ArrayList<>();
        for (PlayerField field : PlayerField.values()) {
            if (field.isContested(target, candidate)) {
                FieldChoice choice = resolutions != null ? resolutions.get(field.getKey()) : null;
                if (choice == FieldChoice.NEW) {
                    field.write(target, field.candidate(candidate));
                    mergedFields.add(field.getKey());
                }
            } else if (field.fillsGap(target, candidate)) {
                field.write(target, field.candidate(candidate));
                mergedFields.add(field.getKey());
            }
        }
        return mergedFields;
    }

    // null = auto : on cumule seulement si la source a déjà un historique
    private boolean shouldCombine(Boolean requested, Player source) {
        if (source == null) return false;
        if (requested != null) return requested;
        CareerStats sourceStats = source.getCareerStats();
        return sourceStats.getTotalMatches() > 0;
    }

    private static PlayerRequest toRequest(Player player) {
        return PlayerRequest.builder()
                .name(player.getName())
                .username(player.getUsername())
                .email(player.getEmail())
                .teamId(player.getTeamId())
                .teamName(player.getTeamName())
                .role(player.getRole())
                .battingStyle(player.getBattingStyle())
                .bowlingStyle(player.getBowlingStyle())
                .jerseyNumber(player.getJerseyNumber())
                .isGuest(player.isGuest())
                .build();
    }

    private static class FieldMerge {
        private final Player player;
        private final List<String> mergedFields;
        private final boolean statsCombined;

        FieldMerge(Player player, List<String> mergedFields, boolean statsCombined) {
            this.player = player;
            this.mergedFields = mergedFields;
            this.statsCombined = statsCombined;
        }
    }
}
