package com.tony.cricketLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Une ligne par joueur et par match. La contrainte unique (match, joueur) est la clé
 * d'idempotence de l'accumulation des stats carrière.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "player_performance", uniqueConstraints = {
        @UniqueConstraint(name = "uk_performance_match_player", columnNames = {"match_id", "player_id"})
})
public class PlayerPerformance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false)
    private Long matchId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    private Long teamId;
    private String opposition;
    private String venue;
    private LocalDateTime matchDate;

    @Enumerated(EnumType.STRING)
    private MatchResult matchResult;

    // Absent si le joueur n'a pas batté
    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "runs", column = @Column(name = "bat_runs")),
            @AttributeOverride(name = "balls", column = @Column(name = "bat_balls"))
    })
    private BattingStats battingStats;

    // Absent si le joueur n'a pas lancé
    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "runs", column = @Column(name = "bowl_runs")),
            @AttributeOverride(name = "overs", column = @Column(name = "bowl_overs"))
    })
    private BowlingStats bowlingStats;

    @Embedded
    private FieldingStats fieldingStats = new FieldingStats();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "player_performance_award", joinColumns = @JoinColumn(name = "performance_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "award")
    private Set<Award> awards = EnumSet.noneOf(Award.class);

    public PlayerPerformance(Long matchId, Long playerId, Long teamId) {
        this.matchId = matchId;
        this.playerId = playerId;
        this.teamId = teamId;
    }

    public FieldingStats getFieldingStats() {
        if (fieldingStats == null) {
            fieldingStats = new FieldingStats();
        }
        return fieldingStats;
    }

    public boolean isWin() {
        return matchResult == MatchResult.WON;
    }
}
