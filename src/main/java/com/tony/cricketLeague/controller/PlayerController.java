package com.tony.cricketLeague.controller;

import com.tony.cricketLeague.model.Player;
import com.tony.cricketLeague.model.PlayerPerformance;
import com.tony.cricketLeague.model.dto.IdentityMatch;
import com.tony.cricketLeague.model.dto.MergeRequest;
import com.tony.cricketLeague.model.dto.MergeResult;
import com.tony.cricketLeague.model.dto.PlayerRequest;
import com.tony.cricketLeague.service.PlayerIdentityMatcher;
import com.tony.cricketLeague.service.PlayerMergeService;
import com.tony.cricketLeague.service.PlayerService;
import com.tony.cricketLeague.service.PlayerStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/players")
@RequiredArgsConstructor
public class PlayerController {
    private final PlayerService playerService;
    private final PlayerIdentityMatcher identityMatcher;
    private final PlayerMergeService mergeService;
    private final PlayerStatsService playerStatsService;

    // 201, ou 409 avec le payload de conflit si l'email existe déjà
    @PostMapping
    public ResponseEntity<Player> createPlayer(@Valid @RequestBody PlayerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(playerService.createPlayer(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Player> updatePlayer(@PathVariable Long id, @RequestBody PlayerRequest request) {
        return ResponseEntity.ok(playerService.updatePlayer(id, request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Player> getPlayer(@PathVariable Long id) {
        return ResponseEntity.ok(playerService.getPlayer(id));
    }

    @GetMapping("/identity")
    public ResponseEntity<IdentityMatch> checkIdentity(@RequestParam String email) {
        return ResponseEntity.ok(identityMatcher.match(email));
    }

    @PostMapping("/merge")
    public ResponseEntity<MergeResult> mergePlayers(@Valid @RequestBody MergeRequest request) {
        return ResponseEntity.ok(mergeService.merge(request));
    }

    @GetMapping("/{id}/performances")
    public ResponseEntity<List<PlayerPerformance>> getPerformances(@PathVariable Long id) {
        return ResponseEntity.ok(playerStatsService.getPerformances(id));
    }

    @PostMapping("/{id}/performances")
    public ResponseEntity<PlayerPerformance> recordPerformance(@PathVariable Long id,
                                                               @RequestBody PlayerPerformance performance) {
        performance.setId(null);
        performance.setPlayerId(id);
        if (!playerStatsService.recordPerformance(performance)) {
            throw new IllegalStateException(String.format(
                    "Performance already recorded for player %s in match %s", id, performance.getMatchId()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(performance);
    }
}
