package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Une manche du scorecard : l'équipe qui bat, son total et les lignes batteurs/lanceurs.
 */
@Entity
@Getter @Setter @NoArgsConstructor
public class Innings {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "match_id")
    private CricketMatch match;

    @JsonIgnore
    @Enumerated(EnumType.STRING)
    private InningsSide side;

    @NotNull(message = "battingTeamId est requis")
    private Long battingTeamId;

    @PositiveOrZero
    private Integer totalRuns;

    @PositiveOrZero
    private Integer totalWickets;

    // Notation cricket : 19.4 = 19 overs et 4 balles
    @PositiveOrZero
    private Double totalOvers;

    @ElementCollection
    @CollectionTable(name = "innings_batsman", joinColumns = @JoinColumn(name = "innings_id"))
    @OrderColumn(name = "batting_order")
    private List<BatsmanEntry> batsmen = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "innings_bowler", joinColumns = @JoinColumn(name = "innings_id"))
    @OrderColumn(name = "bowling_order")
    private List<BowlerEntry> bowlers = new ArrayList<>();

    public Innings(Long battingTeamId, Integer totalRuns, Integer totalWickets, Double totalOvers) {
        this.battingTeamId = battingTeamId;
        this.totalRuns = totalRuns;
        this.totalWickets = totalWickets;
        this.totalOvers = totalOvers;
    }

    public int runsOrZero() {
        return totalRuns != null ? totalRuns : 0;
    }

    public int wicketsOrZero() {
        return totalWickets != null ? totalWickets : 0;
    }

    /** true si au moins une ligne référence le joueur (batteur, fielder ou lanceur). */
    public boolean references(Long playerId) {
        return batsmen.stream().anyMatch(b -> playerId.equals(b.getPlayerId()) || playerId.equals(b.getFielderId()))
                || bowlers.stream().anyMatch(b -> playerId.equals(b.getPlayerId()));
    }

    public void replacePlayer(Long oldId, Long newId) {
        for (BatsmanEntry b : batsmen) {
            if (oldId.equals(b.getPlayerId())) b.setPlayerId(newId);
            if (oldId.equals(b.getFielderId())) b.setFielderId(newId);
        }
        for (BowlerEntry b : bowlers) {
            if (oldId.equals(b.getPlayerId())) b.setPlayerId(newId);
        }
    }
}
