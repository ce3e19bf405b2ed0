package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Match (données externes, lues par le coeur sauf à la clôture).
 * Le scorecard est stocké en manches ; team1Innings / team2Innings en sont des vues.
 */
@Entity
@Table(name = "cricket_match")
@Getter @Setter @NoArgsConstructor
public class CricketMatch {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    private String title;

    private Long team1Id;
    private Long team2Id;
    private String team1Name;
    private String team2Name;

    private String venue;
    private LocalDateTime matchDate;
    private String matchFormat; // T20, ODI, Test...

    @Enumerated(EnumType.STRING)
    private MatchStatus status = MatchStatus.SCHEDULED;

    @JsonIgnore
    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Innings> innings = new ArrayList<>();

    @Embedded
    private ResultSummary resultSummary;

    @Embedded
    private MatchAwards awards;

    public CricketMatch(Long team1Id, String team1Name, Long team2Id, String team2Name) {
        this.team1Id = team1Id;
        this.team1Name = team1Name;
        this.team2Id = team2Id;
        this.team2Name = team2Name;
    }

    public List<Innings> getTeam1Innings() {
        return innings.stream().filter(i -> i.getSide() == InningsSide.TEAM1).toList();
    }

    public List<Innings> getTeam2Innings() {
        return innings.stream().filter(i -> i.getSide() == InningsSide.TEAM2).toList();
    }

    public void addInnings(InningsSide side, Innings inning) {
        inning.setSide(side);
        inning.setMatch(this);
        innings.add(inning);
    }

    /** Remplace tout le scorecard (clôture du match). */
    public void replaceScorecard(List<Innings> team1Innings, List<Innings> team2Innings) {
        innings.clear();
        team1Innings.forEach(i -> addInnings(InningsSide.TEAM1, i));
        team2Innings.forEach(i -> addInnings(InningsSide.TEAM2, i));
    }

    public boolean involves(Long teamId) {
        return teamId != null && (teamId.equals(team1Id) || teamId.equals(team2Id));
    }

    public Long opponentOf(Long teamId) {
        return teamId != null && teamId.equals(team1Id) ? team2Id : team1Id;
    }

    public String nameOf(Long teamId) {
        if (teamId == null) return null;
        if (teamId.equals(team1Id)) return team1Name;
        if (teamId.equals(team2Id)) return team2Name;
        return null;
    }

    public boolean isCompleted() {
        return status == MatchStatus.COMPLETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CricketMatch)) return false;
        return id != null && id.equals(((CricketMatch) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
