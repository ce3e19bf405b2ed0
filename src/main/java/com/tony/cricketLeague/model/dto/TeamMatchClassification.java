package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.MatchOutcome;
import com.tony.cricketLeague.model.SkipReason;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TeamMatchClassification {
    private Long matchId;
    private boolean participated;
    private MatchOutcome outcome; // null si l'équipe n'a pas participé
    private SkipReason skipReason;
    private InningsContribution battingContribution;
    private InningsContribution bowlingContribution;

    public static TeamMatchClassification notParticipated(Long matchId) {
        return new TeamMatchClassification(matchId, false, null, SkipReason.NOT_PARTICIPATED,
                new InningsContribution(), new InningsContribution());
    }

    public static TeamMatchClassification skipped(Long matchId, SkipReason reason) {
        return new TeamMatchClassification(matchId, true, MatchOutcome.SKIP, reason,
                new InningsContribution(), new InningsContribution());
    }

    public boolean counts() {
        return participated && outcome != null && outcome != MatchOutcome.SKIP;
    }
}
