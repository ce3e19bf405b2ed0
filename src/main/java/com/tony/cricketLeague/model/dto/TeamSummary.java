package com.tony.cricketLeague.model.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TeamSummary {
    private Long teamId;
    private String teamName;
    private Integer standingPosition;

    // Matchs avec un vrai résultat uniquement (V + D + N)
    private int totalMatches;
    private int wins;
    private int losses;
    private int draws;
    private double winRate;
    private int tournamentPoints;

    private int runsScored;
    private int runsConceded;
    private int wicketsTaken;
    private int wicketsLost;
    private int ballsFaced;
    private int ballsBowled;

    private boolean hasNRRData;
    // null quand hasNRRData = false : jamais affiché comme 0.000
    private Double netRunRate;

    private int matchesSkipped;
}
