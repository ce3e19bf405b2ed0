package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Résultat d'un match vu depuis l'équipe d'un joueur (stocké sur PlayerPerformance).
 */
public enum MatchResult {
    @JsonProperty("won") WON,
    @JsonProperty("lost") LOST,
    @JsonProperty("tied") TIED,
    @JsonProperty("no-result") NO_RESULT
}
