package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.MatchRosterEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface MatchRosterEntryRepository extends JpaRepository<MatchRosterEntry, Long> {

    List<MatchRosterEntry> findByMatchId(Long matchId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE MatchRosterEntry r SET r.playerId = :newId WHERE r.playerId = :oldId")
    int reassignPlayer(@Param("oldId") Long oldId, @Param("newId") Long newId);
}
