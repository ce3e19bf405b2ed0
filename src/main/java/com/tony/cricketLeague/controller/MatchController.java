package com.tony.cricketLeague.controller;

import com.tony.cricketLeague.model.dto.MatchCompletionRequest;
import com.tony.cricketLeague.model.dto.MatchCompletionResult;
import com.tony.cricketLeague.service.MatchCompletionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {
    private final MatchCompletionService matchCompletionService;

    // 207 si certains joueurs n'ont pas pu être traités (le match reste ouvert)
    @PatchMapping("/{id}/complete")
    public ResponseEntity<MatchCompletionResult> completeMatch(@PathVariable Long id,
                                                               @Valid @RequestBody MatchCompletionRequest request) {
        MatchCompletionResult result = matchCompletionService.completeMatch(id, request);
        HttpStatus status = result.hasErrors() ? HttpStatus.MULTI_STATUS : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
