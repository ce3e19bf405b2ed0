package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RankingServiceTest {

    @Mock
    private TeamRepository teamRepository;

    private RankingService rankingService;

    @BeforeEach
    void setUp() {
        rankingService = new RankingService(teamRepository, new TeamStatsAggregator(new LeagueStatsProperties()));
    }

    @Test
    void updateStandings_ShouldSortByPointsThenNrrThenWins() {
        // ARRANGE
        Team leader = team(1L, "Leader", stats(3, 0, 1.2));      // 6 pts
        Team betterNrr = team(2L, "Better NRR", stats(2, 0, 0.9));  // 4 pts
        Team worseNrr = team(3L, "Worse NRR", stats(2, 0, -0.3));  // 4 pts
        Team noNrr = team(4L, "No NRR", stats(2, 0, null));        // 4 pts, NRR inconnu
        Team fresh = team(5L, "Fresh", null);
        when(teamRepository.findBySportIgnoreCase("cricket"))
                .thenReturn(List.of(fresh, noNrr, worseNrr, leader, betterNrr));

        // ACT
        List<TeamSummary> standings = rankingService.updateStandings("cricket");

        // ASSERT
        assertThat(standings).extracting(TeamSummary::getTeamName)
                .containsExactly("Leader", "Better NRR", "Worse NRR", "No NRR", "Fresh");
        assertThat(leader.getCurrentStats().getStandingPosition()).isEqualTo(1);
        assertThat(noNrr.getCurrentStats().getStandingPosition()).isEqualTo(4);
        assertThat(fresh.getCurrentStats()).isNull();
        verify(teamRepository, times(1)).saveAll(anyList());
    }

    @Test
    void updateStandings_NoTeamShouldDoNothing() {
        when(teamRepository.findBySportIgnoreCase("cricket")).thenReturn(List.of());

        assertThat(rankingService.updateStandings("cricket")).isEmpty();
        verify(teamRepository, never()).saveAll(anyList());
    }

    @Test
    void getStandings_ShouldNotPersist() {
        Team a = team(1L, "A", stats(1, 1, 0.2));
        Team b = team(2L, "B", stats(2, 0, -0.1));
        when(teamRepository.findBySportIgnoreCase("cricket")).thenReturn(List.of(a, b));

        List<TeamSummary> standings = rankingService.getStandings("cricket");

        assertThat(standings).extracting(TeamSummary::getTeamName).containsExactly("B", "A");
        assertThat(standings.get(0).getStandingPosition()).isEqualTo(1);
        verify(teamRepository, never()).saveAll(anyList());
    }

    private Team team(Long id, String name, TeamStats stats) {
        Team team = new Team(name, "cricket");
        team.setId(id);
        team.setCurrentStats(stats);
        return team;
    }

    private TeamStats stats(int wins, int losses, Double nrr) {
        return TeamStats.builder()
                .wins(wins)
                .losses(losses)
                .totalMatches(wins + losses)
                .tournamentPoints(wins * 2)
                .netRunRate(nrr)
                .build();
    }
}
