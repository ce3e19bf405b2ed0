package com.tony.cricketLeague.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "league.stats")
@Data
public class LeagueStatsProperties {
    // --- Barème du classement ---
    private int pointsPerWin = 2;
    private int pointsPerDraw = 1;

    // Nombre de décimales du Net Run Rate (ex: +1.234)
    private int nrrScale = 3;

    // --- Concurrence ---
    // Nouvelles tentatives quand deux clôtures de match touchent le même joueur (verrou optimiste)
    private int maxAccumulationRetries = 3;

    // --- File de réparation des références (fusion de joueurs) ---
    private int repairMaxAttempts = 5;
    private String repairCron = "0 */15 * * * *";
}
