package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.Award;
import com.tony.cricketLeague.model.BattingStats;
import com.tony.cricketLeague.model.BowlingStats;
import com.tony.cricketLeague.model.FieldingStats;
import com.tony.cricketLeague.model.PlayerPerformance;
import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Delta d'un match pour un joueur, tel que consommé par l'accumulateur carrière.
 */
@Value
@Builder
public class MatchPerformanceInput {
    BattingStats batting;   // null = n'a pas batté
    BowlingStats bowling;   // null = n'a pas lancé
    FieldingStats fielding;
    boolean matchWon;
    @Builder.Default
    Set<Award> awards = EnumSet.noneOf(Award.class);

    public static MatchPerformanceInput from(PlayerPerformance performance) {
        return MatchPerformanceInput.builder()
                .batting(performance.getBattingStats())
                .bowling(performance.getBowlingStats())
                .fielding(performance.getFieldingStats())
                .matchWon(performance.isWin())
                .awards(performance.getAwards().isEmpty() ? EnumSet.noneOf(Award.class) : EnumSet.copyOf(performance.getAwards()))
                .build();
    }
}
