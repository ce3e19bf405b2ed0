package com.tony.cricketLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MatchCompletionResult {
    private Long matchId;
    private boolean completed;
    private int playersProcessed;
    // Performances déjà enregistrées (requête de clôture rejouée)
    private int playersSkipped;
    private int totalPlayers;
    private List<String> errors;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
