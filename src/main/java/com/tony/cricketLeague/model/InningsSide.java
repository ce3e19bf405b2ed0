package com.tony.cricketLeague.model;

/**
 * Tableau du scorecard auquel appartient une manche (team1Innings / team2Innings).
 */
public enum InningsSide {
    TEAM1,
    TEAM2
}
