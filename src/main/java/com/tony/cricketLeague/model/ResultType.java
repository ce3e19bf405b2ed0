package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ResultType {
    @JsonProperty("normal") NORMAL,
    @JsonProperty("tied") TIED,
    @JsonProperty("no-result") NO_RESULT,
    @JsonProperty("abandoned") ABANDONED
}
