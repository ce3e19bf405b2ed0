package com.tony.cricketLeague.service;

import com.tony.cricketLeague.config.LeagueStatsProperties;
import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.CricketMatch;
import com.tony.cricketLeague.model.Innings;
import com.tony.cricketLeague.model.InningsSide;
import com.tony.cricketLeague.model.MatchStatus;
import com.tony.cricketLeague.model.ResultSummary;
import com.tony.cricketLeague.model.ResultType;
import com.tony.cricketLeague.model.Team;
import com.tony.cricketLeague.model.TeamStats;
import com.tony.cricketLeague.model.dto.TeamSummary;
import com.tony.cricketLeague.repository.CricketMatchRepository;
import com.tony.cricketLeague.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TeamStatsServiceTest {

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private CricketMatchRepository matchRepository;

    private TeamStatsService teamStatsService;
    private Team red;
    private Team blue;

    @BeforeEach
    void setUp() {
        teamStatsService = new TeamStatsService(teamRepository, matchRepository,
                new TeamResultClassifier(), new TeamStatsAggregator(new LeagueStatsProperties()));
        red = new Team("Red", "cricket");
        red.setId(1L);
        blue = new Team("Blue", "cricket");
        blue.setId(2L);
    }

    @Test
    void recalculateTeamStats_ShouldReplayCompletedMatches() {
        // ARRANGE : un ancien cumul faux, le rang doit être conservé
        red.setCurrentStats(TeamStats.builder().wins(9).standingPosition(3).build());
        when(teamRepository.findById(1L)).thenReturn(Optional.of(red));
        when(matchRepository.findByTeamAndStatus(1L, MatchStatus.COMPLETED)).thenReturn(List.of(
                completed(100L, ResultType.NORMAL, 1L, 150, 140),
                completed(101L, ResultType.TIED, null, 120, 120),
                completed(102L, ResultType.NO_RESULT, null, 30, 0)));

        // ACT
        TeamSummary summary = teamStatsService.recalculateTeamStats(1L);

        // ASSERT
        assertThat(summary.getWins()).isEqualTo(1);
        assertThat(summary.getDraws()).isEqualTo(1);
        assertThat(summary.getTotalMatches()).isEqualTo(2);
        assertThat(summary.getTournamentPoints()).isEqualTo(3);
        assertThat(summary.getMatchesSkipped()).isEqualTo(1);
        assertThat(summary.getRunsScored()).isEqualTo(270);
        assertThat(red.getCurrentStats().getStandingPosition()).isEqualTo(3);
        verify(teamRepository).save(red);
    }

    @Test
    void applyCompletedMatch_ShouldUpdateBothTeams() {
        CricketMatch match = completed(100L, ResultType.NORMAL, 2L, 150, 151);
        when(matchRepository.findById(100L)).thenReturn(Optional.of(match));
        when(teamRepository.findById(1L)).thenReturn(Optional.of(red));
        when(teamRepository.findById(2L)).thenReturn(Optional.of(blue));

        teamStatsService.applyCompletedMatch(100L);

        assertThat(red.getCurrentStats().getLosses()).isEqualTo(1);
        assertThat(red.getCurrentStats().getTournamentPoints()).isZero();
        assertThat(blue.getCurrentStats().getWins()).isEqualTo(1);
        assertThat(blue.getCurrentStats().getTournamentPoints()).isEqualTo(2);
        assertThat(blue.getCurrentStats().getRunsScored()).isEqualTo(151);
        verify(teamRepository, times(2)).save(any(Team.class));
    }

    @Test
    void getTeamSummary_NewTeamShouldHaveNoNrr() {
        when(teamRepository.findById(1L)).thenReturn(Optional.of(red));

        TeamSummary summary = teamStatsService.getTeamSummary(1L);

        assertThat(summary.getTotalMatches()).isZero();
        assertThat(summary.isHasNRRData()).isFalse();
        assertThat(summary.getNetRunRate()).isNull();
    }

    @Test
    void getTeamSummary_UnknownTeamShouldFail() {
        when(teamRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> teamStatsService.getTeamSummary(404L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private CricketMatch completed(Long id, ResultType type, Long winnerId, int redRuns, int blueRuns) {
        CricketMatch match = new CricketMatch(1L, "Red", 2L, "Blue");
        match.setId(id);
        match.setStatus(MatchStatus.COMPLETED);
        match.setResultSummary(new ResultSummary(type, winnerId));
        match.addInnings(InningsSide.TEAM1, new Innings(1L, redRuns, 5, 20.0));
        match.addInnings(InningsSide.TEAM2, new Innings(2L, blueRuns, 7, 20.0));
        return match;
    }
}
