package com.tony.cricketLeague.model;

public enum SkipReason {
    NOT_PARTICIPATED,
    NO_RESULT,
    ABANDONED,
    // "AmbiguousResult" : pas de résultat structuré exploitable
    NO_DEFINITIVE_RESULT
}
