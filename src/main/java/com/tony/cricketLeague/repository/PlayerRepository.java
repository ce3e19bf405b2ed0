package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    // Correspondance exacte insensible à la casse (pas de fuzzy matching)
    List<Player> findByEmailIgnoreCaseOrderByIdAsc(String email);

    Optional<Player> findFirstByUserId(Long userId);

    List<Player> findByTeamId(Long teamId);
}
