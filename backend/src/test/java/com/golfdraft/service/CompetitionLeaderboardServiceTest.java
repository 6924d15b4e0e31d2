package com.golfdraft.service;

import com.golfdraft.dto.ScoringResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Competition;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentStatus;
import com.golfdraft.repository.CompetitionBountyRepository;
import com.golfdraft.repository.CompetitionPaymentRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompetitionLeaderboardServiceTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000c21");
    private static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000721");

    @Mock
    private CompetitionRepository competitionRepository;
    @Mock
    private TournamentRepository tournamentRepository;
    @Mock
    private CompetitionScoreRepository competitionScoreRepository;
    @Mock
    private CompetitionPaymentRepository competitionPaymentRepository;
    @Mock
    private CompetitionBountyRepository competitionBountyRepository;
    @Mock
    private UserProfileRepository userProfileRepository;
    @Mock
    private CompetitionStandingsLoader competitionStandingsLoader;
    @Mock
    private CompetitionFinalizationService competitionFinalizationService;

    private CompetitionLeaderboardService competitionLeaderboardService;

    @BeforeEach
    void setUp() {
        competitionLeaderboardService = new CompetitionLeaderboardService(
                competitionRepository,
                tournamentRepository,
                competitionScoreRepository,
                competitionPaymentRepository,
                competitionBountyRepository,
                userProfileRepository,
                competitionStandingsLoader,
                competitionFinalizationService,
                new GolfDraftResponseMapper()
        );
    }

    @Test
    void failedFinalizationFallsBackToLiveStandings() {
        Competition competition = competition();
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(tournamentRepository.findById(TOURNAMENT_ID)).thenReturn(Optional.of(tournament(TournamentStatus.COMPLETED)));
        when(competitionScoreRepository.existsByCompetitionId(COMPETITION_ID)).thenReturn(false);
        when(competitionFinalizationService.finalizeCompetition(COMPETITION_ID))
                .thenThrow(new CannotAcquireLockException("lock timeout"));
        when(competitionStandingsLoader.load(competition))
                .thenReturn(new CompetitionStandingsLoader.Standings(List.of(), Map.of(), List.of()));
        when(userProfileRepository.findByIdIn(any())).thenReturn(List.of());

        ScoringResponses.Leaderboard leaderboard = competitionLeaderboardService.getLeaderboard(COMPETITION_ID);

        assertFalse(leaderboard.finalized());
        assertFalse(leaderboard.scoresAvailable());
        assertTrue(leaderboard.entries().isEmpty());
    }

    @Test
    void runningTournamentIsNeverFinalizedOnRead() {
        Competition competition = competition();
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(tournamentRepository.findById(TOURNAMENT_ID)).thenReturn(Optional.of(tournament(TournamentStatus.ACTIVE)));
        when(competitionScoreRepository.existsByCompetitionId(COMPETITION_ID)).thenReturn(false);
        when(competitionStandingsLoader.load(competition))
                .thenReturn(new CompetitionStandingsLoader.Standings(List.of(), Map.of(), List.of()));
        when(userProfileRepository.findByIdIn(any())).thenReturn(List.of());

        competitionLeaderboardService.getLeaderboard(COMPETITION_ID);

        verify(competitionFinalizationService, never()).finalizeCompetition(any());
    }

    @Test
    void unknownCompetitionIsNotFound() {
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> competitionLeaderboardService.getLeaderboard(COMPETITION_ID));

        assertEquals(404, ex.getStatusCode().value());
    }

    private static Competition competition() {
        Competition competition = new Competition();
        competition.setId(COMPETITION_ID);
        competition.setTournamentId(TOURNAMENT_ID);
        competition.setName("Weekend Pool");
        competition.setCreatedBy(UUID.fromString("00000000-0000-0000-0000-00000000f101"));
        return competition;
    }

    private static Tournament tournament(TournamentStatus status) {
        Tournament tournament = new Tournament();
        tournament.setId(TOURNAMENT_ID);
        tournament.setName("Test Invitational");
        tournament.setStatus(status);
        return tournament;
    }
}
