package com.golfdraft.service;

import com.golfdraft.config.GolfDraftProperties;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Competition;
import com.golfdraft.model.DraftOrderEntry;
import com.golfdraft.model.DraftOrderMode;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.Tournament;
import com.golfdraft.repository.AlternateRepository;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.DraftOrderRepository;
import com.golfdraft.repository.DraftPickRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import com.golfdraft.web.CompetitionRuleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DraftServiceTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000c11");
    private static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000711");
    private static final UUID GOLFER_ID = UUID.fromString("00000000-0000-0000-0000-000000000611");
    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000f001");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000f002");
    private static final UUID MALLORY = UUID.fromString("00000000-0000-0000-0000-00000000f009");

    @Mock
    private CompetitionRepository competitionRepository;
    @Mock
    private TournamentRepository tournamentRepository;
    @Mock
    private CompetitionParticipantRepository competitionParticipantRepository;
    @Mock
    private DraftOrderRepository draftOrderRepository;
    @Mock
    private DraftPickRepository draftPickRepository;
    @Mock
    private AlternateRepository alternateRepository;
    @Mock
    private GolferRepository golferRepository;
    @Mock
    private CompetitionScoreRepository competitionScoreRepository;
    @Mock
    private UserProfileRepository userProfileRepository;

    private DraftService draftService;

    @BeforeEach
    void setUp() {
        draftService = new DraftService(
                competitionRepository,
                tournamentRepository,
                competitionParticipantRepository,
                draftOrderRepository,
                draftPickRepository,
                alternateRepository,
                golferRepository,
                competitionScoreRepository,
                userProfileRepository,
                new SnakeDraftTurnResolver(),
                new DraftOrderGenerator(new Random(17)),
                new GolfDraftProperties(),
                new GolfDraftResponseMapper()
        );
    }

    @Test
    void makePickRejectsParticipantOutOfTurn() {
        stubRunningDraft(0);

        CompetitionRuleException ex = assertThrows(CompetitionRuleException.class,
                () -> draftService.makePick(COMPETITION_ID, BOB, GOLFER_ID));

        assertEquals("not_your_turn", ex.getCode());
        verify(draftPickRepository, never()).saveAndFlush(any(DraftPick.class));
    }

    @Test
    void makePickRejectsGolferAlreadyDrafted() {
        stubRunningDraft(0);
        when(golferRepository.findById(GOLFER_ID)).thenReturn(Optional.of(golfer()));
        when(draftPickRepository.existsByCompetitionIdAndGolferId(COMPETITION_ID, GOLFER_ID)).thenReturn(true);

        CompetitionRuleException ex = assertThrows(CompetitionRuleException.class,
                () -> draftService.makePick(COMPETITION_ID, ALICE, GOLFER_ID));

        assertEquals("golfer_already_drafted", ex.getCode());
        verify(draftPickRepository, never()).saveAndFlush(any(DraftPick.class));
    }

    @Test
    void finalPickCompletesDraft() {
        Competition competition = stubRunningDraft(5);
        when(golferRepository.findById(GOLFER_ID)).thenReturn(Optional.of(golfer()));
        when(draftPickRepository.existsByCompetitionIdAndGolferId(COMPETITION_ID, GOLFER_ID)).thenReturn(false);
        when(draftPickRepository.saveAndFlush(any(DraftPick.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DraftResponses.Pick pick = draftService.makePick(COMPETITION_ID, BOB, GOLFER_ID);

        assertEquals(6, pick.pickNumber());
        assertEquals(3, pick.draftRound());
        assertEquals("Test Golfer", pick.golferName());
        assertEquals(DraftStatus.COMPLETED, competition.getDraftStatus());
        verify(competitionRepository).save(competition);
    }

    @Test
    void concurrentPickSurfacesAsPickConflict() {
        stubRunningDraft(0);
        when(golferRepository.findById(GOLFER_ID)).thenReturn(Optional.of(golfer()));
        when(draftPickRepository.existsByCompetitionIdAndGolferId(COMPETITION_ID, GOLFER_ID)).thenReturn(false);
        when(draftPickRepository.saveAndFlush(any(DraftPick.class)))
                .thenThrow(new DataIntegrityViolationException("uq_draft_picks_pick_number"));

        CompetitionRuleException ex = assertThrows(CompetitionRuleException.class,
                () -> draftService.makePick(COMPETITION_ID, ALICE, GOLFER_ID));

        assertEquals("pick_conflict", ex.getCode());
    }

    @Test
    void makePickRequiresDraftInProgress() {
        Competition competition = competition(DraftStatus.COMPLETED);
        when(competitionRepository.findByIdForUpdate(COMPETITION_ID)).thenReturn(Optional.of(competition));

        CompetitionRuleException ex = assertThrows(CompetitionRuleException.class,
                () -> draftService.makePick(COMPETITION_ID, ALICE, GOLFER_ID));

        assertEquals("draft_not_in_progress", ex.getCode());
    }

    @Test
    void startDraftIsLimitedToCreatorOrAdmin() {
        when(competitionRepository.findByIdForUpdate(COMPETITION_ID))
                .thenReturn(Optional.of(competition(DraftStatus.NOT_STARTED)));
        when(userProfileRepository.existsByIdAndAdminTrue(MALLORY)).thenReturn(false);

        CompetitionRuleException ex = assertThrows(CompetitionRuleException.class,
                () -> draftService.startDraft(COMPETITION_ID, MALLORY, DraftOrderMode.RANDOM));

        assertEquals("forbidden", ex.getCode());
        verify(draftOrderRepository, never()).saveAll(anyList());
    }

    @Test
    void scheduledDraftDoesNotAutoStartInsideGuardWindow() {
        Competition competition = competition(DraftStatus.NOT_STARTED);
        competition.setDraftScheduledAt(OffsetDateTime.now().minusHours(1));
        Tournament tournament = tournament(OffsetDateTime.now().plusHours(3));
        when(competitionRepository.existsByIdAndDraftStatusAndDraftScheduledAtLessThanEqual(
                eq(COMPETITION_ID), eq(DraftStatus.NOT_STARTED), any(OffsetDateTime.class))).thenReturn(true);
        when(competitionRepository.findByIdForUpdate(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(competitionParticipantRepository.countByCompetitionId(COMPETITION_ID)).thenReturn(3L);
        when(tournamentRepository.findById(TOURNAMENT_ID)).thenReturn(Optional.of(tournament));

        assertFalse(draftService.maybeAutoStartDraft(COMPETITION_ID));

        assertEquals(DraftStatus.NOT_STARTED, competition.getDraftStatus());
        verify(draftOrderRepository, never()).saveAll(anyList());
    }

    private Competition stubRunningDraft(long picksMade) {
        Competition competition = competition(DraftStatus.IN_PROGRESS);
        when(competitionRepository.findByIdForUpdate(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(tournamentRepository.findById(TOURNAMENT_ID))
                .thenReturn(Optional.of(tournament(OffsetDateTime.now().plusDays(2))));
        when(draftOrderRepository.findByCompetitionIdOrderByPositionAsc(COMPETITION_ID))
                .thenReturn(List.of(orderEntry(ALICE, 1), orderEntry(BOB, 2)));
        when(draftPickRepository.countByCompetitionId(COMPETITION_ID)).thenReturn(picksMade);
        return competition;
    }

    private static Competition competition(DraftStatus status) {
        Competition competition = new Competition();
        competition.setId(COMPETITION_ID);
        competition.setTournamentId(TOURNAMENT_ID);
        competition.setName("Sunday Major");
        competition.setCreatedBy(ALICE);
        competition.setDraftStatus(status);
        return competition;
    }

    private static Tournament tournament(OffsetDateTime startTime) {
        Tournament tournament = new Tournament();
        tournament.setId(TOURNAMENT_ID);
        tournament.setExternalId("401580329");
        tournament.setName("Test Open");
        tournament.setStartTime(startTime);
        tournament.setEndDate(startTime.plusDays(3).toLocalDate());
        return tournament;
    }

    private static DraftOrderEntry orderEntry(UUID userId, int position) {
        DraftOrderEntry entry = new DraftOrderEntry();
        entry.setId(UUID.randomUUID());
        entry.setCompetitionId(COMPETITION_ID);
        entry.setUserId(userId);
        entry.setPosition(position);
        return entry;
    }

    private static Golfer golfer() {
        Golfer golfer = new Golfer();
        golfer.setId(GOLFER_ID);
        golfer.setExternalId("9478");
        golfer.setDisplayName("Test Golfer");
        return golfer;
    }
}
