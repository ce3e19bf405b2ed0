package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Choix de résolution d'un champ en conflit lors d'une fusion de joueurs.
 */
public enum FieldChoice {
    @JsonProperty("existing") EXISTING,
    @JsonProperty("new") NEW
}
