package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MatchOutcome {
    @JsonProperty("win") WIN,
    @JsonProperty("loss") LOSS,
    @JsonProperty("draw") DRAW,
    // Exclu des bilans V/D/N et du NRR
    @JsonProperty("skip") SKIP
}
