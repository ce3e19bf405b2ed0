package com.tony.cricketLeague.controller;

import com.tony.cricketLeague.model.dto.RewriteReport;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.repository.TeamRepository;
import com.tony.cricketLeague.service.PlayerReferenceRewriter;
import com.tony.cricketLeague.service.RankingService;
import com.tony.cricketLeague.service.ReferenceRepairService;
import com.tony.cricketLeague.service.TeamStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final PlayerReferenceRewriter referenceRewriter;
    private final ReferenceRepairService repairService;
    private final TeamStatsService teamStatsService;
    private final RankingService rankingService;
    private final TeamRepository teamRepository;

    // 1. Réécriture manuelle des références d'un joueur vers un autre
    @PostMapping("/players/{oldId}/references/{newId}")
    public ResponseEntity<RewriteReport> rewriteReferences(@PathVariable Long oldId, @PathVariable Long newId) {
        if (oldId.equals(newId)) {
            throw new IllegalArgumentException("Old and new player ids must differ");
        }
        return ResponseEntity.ok(referenceRewriter.rewrite(oldId, newId));
    }

    // 2. Passage immédiat de la file de réparation (sans attendre le cron)
    @PostMapping("/repair-references")
    public ResponseEntity<Map<String, Integer>> repairReferences() {
        int repaired = repairService.processPending();
        return ResponseEntity.ok(Map.of("repaired", repaired));
    }

    // 3. Recalcul complet des stats d'équipe puis des classements
    @PostMapping("/recalculate-all")
    public ResponseEntity<Map<String, List<TeamSummary>>> recalculateAll() {
        int teams = teamStatsService.recalculateAll();
        log.info("🔄 {} équipes recalculées", teams);

        Map<String, List<TeamSummary>> standings = new TreeMap<>();
        teamRepository.findAll().stream()
                .map(t -> t.getSport().toLowerCase())
                .distinct()
                .forEach(sport -> standings.put(sport, rankingService.updateStandings(sport)));
        return ResponseEntity.ok(standings);
    }
}
