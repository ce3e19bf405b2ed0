package com.tony.cricketLeague.controller;

import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.service.RankingService;
import com.tony.cricketLeague.service.TeamStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/teams")
@RequiredArgsConstructor
public class TeamController {
    private final TeamStatsService teamStatsService;
    private final RankingService rankingService;

    @GetMapping("/{id}/summary")
    public ResponseEntity<TeamSummary> getSummary(@PathVariable Long id) {
        return ResponseEntity.ok(teamStatsService.getTeamSummary(id));
    }

    @PostMapping("/{id}/recalculate")
    public ResponseEntity<TeamSummary> recalculate(@PathVariable Long id) {
        return ResponseEntity.ok(teamStatsService.recalculateTeamStats(id));
    }

    @GetMapping("/standings")
    public ResponseEntity<List<TeamSummary>> getStandings(@RequestParam(defaultValue = "cricket") String sport) {
        return ResponseEntity.ok(rankingService.getStandings(sport));
    }
}
