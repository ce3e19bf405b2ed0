package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.PlayerPerformance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface PlayerPerformanceRepository extends JpaRepository<PlayerPerformance, Long> {

    // Garde d'idempotence avant toute accumulation
    boolean existsByMatchIdAndPlayerId(Long matchId, Long playerId);

    List<PlayerPerformance> findByPlayerIdOrderByMatchDateDesc(Long playerId);

    // Ordre chronologique pour rejouer une carrière
    List<PlayerPerformance> findByPlayerIdOrderByMatchDateAscIdAsc(Long playerId);

    long countByPlayerId(Long playerId);

    /**
     * Réattribue les performances de l'ancien joueur au nouveau, sauf pour les matchs où
     * le nouveau joueur a déjà sa propre ligne (la contrainte unique serait violée).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PlayerPerformance p SET p.playerId = :newId " +
            "WHERE p.playerId = :oldId AND p.matchId NOT IN " +
            "(SELECT q.matchId FROM PlayerPerformance q WHERE q.playerId = :newId)")
    int reassignPlayer(@Param("oldId") Long oldId, @Param("newId") Long newId);
}
