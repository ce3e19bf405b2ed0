package com.tony.cricketLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Joueur inscrit sur la feuille de match (géré par le module matchs, réécrit lors d'une fusion).
 */
@Entity
@Getter @Setter @NoArgsConstructor
public class MatchRosterEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long matchId;
    private Long playerId;
    private Long teamId;
    private String playerName;
    private String playerEmail;
    private Long userId;

    public MatchRosterEntry(Long matchId, Long playerId, Long teamId, String playerName) {
        this.matchId = matchId;
        this.playerId = playerId;
        this.teamId = teamId;
        this.playerName = playerName;
    }
}
