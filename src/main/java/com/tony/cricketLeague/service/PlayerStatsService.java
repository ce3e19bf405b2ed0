package com.tony.cricketLeague.service;

import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.CareerStats;
import com.tony.cricketLeague.model.Player;
import com.tony.cricketLeague.model.PlayerPerformance;
import com.tony.cricketLeague.model.dto.MatchPerformanceInput;
import com.tony.cricketLeague.repository.PlayerPerformanceRepository;
import com.tony.cricketLeague.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Point d'entrée unique pour toucher aux stats carrière d'un joueur.
 * Idempotent par (matchId, playerId) : la vérification ici + la contrainte unique en base.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerStatsService {

    private final PlayerRepository playerRepository;
    private final PlayerPerformanceRepository performanceRepository;
    private final CareerStatsAccumulator accumulator;

    /**
     * Enregistre la performance et l'accumule dans la carrière du joueur, dans la même transaction.
     *
     * @return false si une performance existe déjà pour ce match et ce joueur (rien n'est modifié)
     */
    @Transactional
    public boolean recordPerformance(PlayerPerformance performance) {
        if (performance.getMatchId() == null || performance.getPlayerId() == null) {
            throw new IllegalArgumentException("matchId and playerId are required to record a performance");
        }

        // 1. Garde d'idempotence (requête de clôture rejouée)
        if (performanceRepository.existsByMatchIdAndPlayerId(performance.getMatchId(), performance.getPlayerId())) {
            log.info("⏭️ Performance déjà enregistrée (match {}, joueur {}), ignorée",
                    performance.getMatchId(), performance.getPlayerId());
            return false;
        }

        Player player = playerRepository.findById(performance.getPlayerId())
                .orElseThrow(() -> new ResourceNotFoundException("Player", performance.getPlayerId()));

        // 2. Insertion d'abord : si un appel concurrent a gagné, la contrainte unique échoue ici
        performanceRepository.saveAndFlush(performance);

        // 3. Accumulation (le @Version du joueur protège le read-modify-write)
        player.setCareerStats(accumulator.accumulate(player.getCareerStats(), MatchPerformanceInput.from(performance)));
        playerRepository.save(player);

        log.debug("Stats carrière mises à jour pour {} (match {})", player.getName(), performance.getMatchId());
        return true;
    }

    /**
     * Recalcule la carrière depuis les lignes de performance du joueur (une par match).
     * Utilisé après une fusion : les lignes en doublon de la source ont été supprimées,
     * la somme des deux carrières compterait ces matchs deux fois.
     */
    @Transactional
    public CareerStats rebuildCareerStats(Long playerId) {
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));

        CareerStats stats = CareerStats.empty();
        List<PlayerPerformance> performances = performanceRepository.findByPlayerIdOrderByMatchDateAscIdAsc(playerId);
        for (PlayerPerformance performance : performances) {
            stats = accumulator.accumulate(stats, MatchPerformanceInput.from(performance));
        }
        player.setCareerStats(stats);
        playerRepository.save(player);

        log.info("🔄 Carrière de {} recalculée depuis {} performance(s)", player.getName(), performances.size());
        return stats;
    }

    @Transactional(readOnly = true)
    public List<PlayerPerformance> getPerformances(Long playerId) {
        if (!playerRepository.existsById(playerId)) {
            throw new ResourceNotFoundException("Player", playerId);
        }
        return performanceRepository.findByPlayerIdOrderByMatchDateDesc(playerId);
    }
}
