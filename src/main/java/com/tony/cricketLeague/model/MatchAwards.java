package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchAwards {
    private Long manOfTheMatchId;
    private Long bestBatsmanId;
    private Long bestBowlerId;
    private Long bestFielderId;

    public Set<Award> awardsFor(Long playerId) {
        Set<Award> awards = EnumSet.noneOf(Award.class);
        if (playerId == null) return awards;
        if (playerId.equals(manOfTheMatchId)) awards.add(Award.MAN_OF_THE_MATCH);
        if (playerId.equals(bestBatsmanId)) awards.add(Award.BEST_BATSMAN);
        if (playerId.equals(bestBowlerId)) awards.add(Award.BEST_BOWLER);
        if (playerId.equals(bestFielderId)) awards.add(Award.BEST_FIELDER);
        return awards;
    }

    public boolean references(Long playerId) {
        return !awardsFor(playerId).isEmpty();
    }

    /** Remplace un identifiant de joueur dans toutes les récompenses. */
    public void replacePlayer(Long oldId, Long newId) {
        if (Objects.equals(manOfTheMatchId, oldId)) manOfTheMatchId = newId;
        if (Objects.equals(bestBatsmanId, oldId)) bestBatsmanId = newId;
        if (Objects.equals(bestBowlerId, oldId)) bestBowlerId = newId;
        if (Objects.equals(bestFielderId, oldId)) bestFielderId = newId;
    }
}
