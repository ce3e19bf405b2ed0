package com.tony.cricketLeague.model;

public enum MatchStatus {
    SCHEDULED,
    LIVE,
    COMPLETED,
    CANCELLED
}
