package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.MatchOutcome;
import com.tony.cricketLeague.model.ResultSummary;
import com.tony.cricketLeague.model.ResultType;
import com.tony.cricketLeague.model.SkipReason;
import com.tony.cricketLeague.model.dto.InningsContribution;
import com.tony.cricketLeague.model.dto.TeamMatchClassification;
import com.tony.cricketLeague.util.OversConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classe un match terminé du point de vue d'une équipe : victoire, défaite, nul ou ignoré.
 * Lecture seule, sans état.
 */
@Component
@Slf4j
public class TeamResultClassifier {

    public TeamMatchClassification classify(CricketMatch match, Long teamId) {
        // 1. L'équipe n'a pas joué ce match
        if (!match.involves(teamId)) {
            return TeamMatchClassification.notParticipated(match.getId());
        }

        ResultSummary result = match.getResultSummary();
        ResultType type = result != null ? result.getResultType() : null;
        Long winnerId = result != null ? result.getWinnerId() : null;

        MatchOutcome outcome;
        if (type == ResultType.TIED) {
            outcome = MatchOutcome.DRAW;
        } else if (winnerId != null) {
            outcome = winnerId.equals(teamId) ? MatchOutcome.WIN : MatchOutcome.LOSS;
        } else if (type == ResultType.NO_RESULT) {
            return TeamMatchClassification.skipped(match.getId(), SkipReason.NO_RESULT);
        } else if (type == ResultType.ABANDONED) {
            return TeamMatchClassification.skipped(match.getId(), SkipReason.ABANDONED);
        } else {
            // Jamais compté comme une défaite ou un nul par défaut
            log.warn("⚠️ Match {} sans résultat exploitable, ignoré pour l'équipe {}", match.getId(), teamId);
            return TeamMatchClassification.skipped(match.getId(), SkipReason.NO_DEFINITIVE_RESULT);
        }

        // 2. Contributions : toutes les manches des deux côtés, cumulées
        InningsContribution batting = new InningsContribution();
        InningsContribution bowling = new InningsContribution();
        scan(match.getTeam1Innings(), teamId, batting, bowling);
        scan(match.getTeam2Innings(), teamId, batting, bowling);

        return new TeamMatchClassification(match.getId(), true, outcome, null, batting, bowling);
    }

    private void scan(List<Innings> innings, Long teamId, InningsContribution batting, InningsContribution bowling) {
        if (innings == null) return;
        for (Innings inning : innings) {
            int balls = OversConverter.oversToBalls(inning.getTotalOvers());
            if (teamId.equals(inning.getBattingTeamId())) {
                batting.add(inning.runsOrZero(), inning.wicketsOrZero(), balls);
            } else {
                bowling.add(inning.runsOrZero(), inning.wicketsOrZero(), balls);
            }
        }
    }
}
