package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.MatchResult;
import com.tony.cricketLeague.model.PlayerPerformance;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class PlayerPerformanceRepositoryTest {

    @Autowired
    private PlayerPerformanceRepository performanceRepository;

    @Test
    void uniqueConstraint_ShouldRejectSecondRowForSameMatchAndPlayer() {
        performanceRepository.saveAndFlush(performance(100L, 1L, 1));

        assertThat(performanceRepository.existsByMatchIdAndPlayerId(100L, 1L)).isTrue();
        assertThat(performanceRepository.existsByMatchIdAndPlayerId(100L, 2L)).isFalse();
        assertThatThrownBy(() -> performanceRepository.saveAndFlush(performance(100L, 1L, 2)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void reassignPlayer_ShouldSkipMatchesAlreadyOwnedByNewPlayer() {
        // ARRANGE : l'ancien joueur a joué 100 et 101, le nouveau a déjà sa ligne sur 101
        performanceRepository.save(performance(100L, 2L, 1));
        performanceRepository.save(performance(101L, 2L, 2));
        performanceRepository.saveAndFlush(performance(101L, 1L, 3));

        // ACT
        int moved = performanceRepository.reassignPlayer(2L, 1L);

        // ASSERT
        assertThat(moved).isEqualTo(1);
        assertThat(performanceRepository.countByPlayerId(1L)).isEqualTo(2);
        List<PlayerPerformance> leftovers = performanceRepository.findByPlayerIdOrderByMatchDateDesc(2L);
        assertThat(leftovers).extracting(PlayerPerformance::getMatchId).containsExactly(101L);
    }

    @Test
    void findByPlayerId_ShouldReturnMostRecentFirst() {
        performanceRepository.save(performance(100L, 1L, 1));
        performanceRepository.save(performance(102L, 1L, 20));
        performanceRepository.save(performance(101L, 1L, 10));

        assertThat(performanceRepository.findByPlayerIdOrderByMatchDateDesc(1L))
                .extracting(PlayerPerformance::getMatchId)
                .containsExactly(102L, 101L, 100L);
    }

    private PlayerPerformance performance(Long matchId, Long playerId, int day) {
        PlayerPerformance perf = new PlayerPerformance(matchId, playerId, 10L);
        perf.setOpposition("Blue");
        perf.setMatchDate(LocalDateTime.of(2024, 5, day, 14, 0));
        perf.setMatchResult(MatchResult.WON);
        return perf;
    }
}
