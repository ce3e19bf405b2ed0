package com.tony.cricketLeague.job;

import com.tony.cricketLeague.service.ReferenceRepairService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceRepairJob {

    private final ReferenceRepairService repairService;

    /**
     * Rejoue les réécritures de références restées incomplètes après une fusion de joueurs.
     * Fréquence : league.stats.repair-cron (toutes les 15 minutes par défaut).
     */
    @Scheduled(cron = "${league.stats.repair-cron:0 */15 * * * *}")
    public void repairReferences() {
        try {
            int repaired = repairService.processPending();
            if (repaired > 0) {
                log.info("✅ [CRON] {} tâche(s) de réparation terminée(s)", repaired);
            }
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du passage de réparation des références", e);
        }
    }
}
