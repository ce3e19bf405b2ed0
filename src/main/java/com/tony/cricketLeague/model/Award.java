package com.tony.cricketLeague.model;

public enum Award {
    MAN_OF_THE_MATCH,
    BEST_BATSMAN,
    BEST_BOWLER,
    BEST_FIELDER
}
