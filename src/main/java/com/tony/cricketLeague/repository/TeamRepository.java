package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findBySportIgnoreCase(String sport);

    // Équipes dont l'effectif contient ce joueur
    @Query("SELECT t FROM Team t WHERE :playerId MEMBER OF t.playerIds")
    List<Team> findByRosterPlayer(@Param("playerId") Long playerId);
}
