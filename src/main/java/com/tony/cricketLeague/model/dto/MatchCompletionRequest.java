package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.MatchAwards;
import com.tony.cricketLeague.model.ResultSummary;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MatchCompletionRequest {
    @Valid
    private List<Innings> team1Innings = new ArrayList<>();

    @Valid
    private List<Innings> team2Innings = new ArrayList<>();

    private MatchAwards awards;

    @NotNull(message = "resultSummary est requis")
    private ResultSummary resultSummary;
}
