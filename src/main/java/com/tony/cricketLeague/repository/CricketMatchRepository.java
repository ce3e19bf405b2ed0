package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.MatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CricketMatchRepository extends JpaRepository<CricketMatch, Long> {

    // Historique d'une équipe (team1 ou team2), du plus ancien au plus récent
    @Query("SELECT m FROM CricketMatch m WHERE " +
            "(m.team1Id = :teamId OR m.team2Id = :teamId) AND m.status = :status " +
            "ORDER BY m.matchDate ASC, m.id ASC")
    List<CricketMatch> findByTeamAndStatus(@Param("teamId") Long teamId, @Param("status") MatchStatus status);

    // Matchs dont une récompense pointe vers ce joueur
    @Query("SELECT m FROM CricketMatch m WHERE " +
            "m.awards.manOfTheMatchId = :playerId OR m.awards.bestBatsmanId = :playerId " +
            "OR m.awards.bestBowlerId = :playerId OR m.awards.bestFielderId = :playerId")
    List<CricketMatch> findByAwardedPlayer(@Param("playerId") Long playerId);
}
