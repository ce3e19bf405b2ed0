package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.Innings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InningsRepository extends JpaRepository<Innings, Long> {

    // Manches dont une ligne batteur, fielder ou lanceur référence le joueur
    @Query("SELECT DISTINCT i FROM Innings i " +
            "LEFT JOIN i.batsmen b LEFT JOIN i.bowlers w " +
            "WHERE b.playerId = :playerId OR b.fielderId = :playerId OR w.playerId = :playerId")
    List<Innings> findReferencingPlayer(@Param("playerId") Long playerId);
}
