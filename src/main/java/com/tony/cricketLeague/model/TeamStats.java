package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cumul des stats d'une équipe, mis à jour après chaque match terminé.
 * Les balles jouées/lancées sont conservées pour pouvoir recalculer le NRR à l'identique.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TeamStats {

    private Integer standingPosition;

    // Bilan (les matchs sans résultat ne sont pas comptés)
    private int totalMatches;
    private int wins;
    private int losses;
    private int draws;
    private int tournamentPoints;

    // Batte
    private int runsScored;
    private int wicketsLost;
    private int ballsFaced;

    // Lancer
    private int runsConceded;
    private int wicketsTaken;
    private int ballsBowled;

    // Null tant que l'équipe n'a pas à la fois batté et lancé
    private Double netRunRate;

    // Matchs ignorés (no-result, abandonnés, sans résultat exploitable)
    private int matchesSkipped;
}
