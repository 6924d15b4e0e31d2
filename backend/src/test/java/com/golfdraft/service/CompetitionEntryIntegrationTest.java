package com.golfdraft.service;

import com.golfdraft.dto.CompetitionRequests;
import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.model.Competition;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.UserProfile;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.DraftOrderRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import com.golfdraft.web.CompetitionRuleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Transactional
class CompetitionEntryIntegrationTest {

    @Autowired
    private CompetitionService competitionService;

    @Autowired
    private DraftService draftService;

    @Autowired
    private UserProfileRepository userProfileRepository;

    @Autowired
    private GolferRepository golferRepository;

    @Autowired
    private TournamentRepository tournamentRepository;

    @Autowired
    private CompetitionRepository competitionRepository;

    @Autowired
    private DraftOrderRepository draftOrderRepository;

    private GolfDraftFixtures fixtures;
    private UserProfile alice;
    private UserProfile bob;

    @BeforeEach
    void setUp() {
        fixtures = new GolfDraftFixtures(userProfileRepository, golferRepository, tournamentRepository);
        alice = fixtures.user("Alice");
        bob = fixtures.user("Bob");
    }

    @Test
    void publicCompetitionIsCreatedOncePerTournament() {
        Tournament tournament = fixtures.tournament("Open", OffsetDateTime.now().plusDays(6), LocalDate.of(2026, 6, 21));

        CompetitionResponses.CompetitionDetail first = competitionService.getOrCreatePublicCompetition(alice.getId(), tournament.getId());
        CompetitionResponses.CompetitionDetail second = competitionService.getOrCreatePublicCompetition(bob.getId(), tournament.getId());

        assertEquals(first.competitionId(), second.competitionId());
        assertTrue(first.publicCompetition());
        assertNull(first.inviteCode());
        assertEquals(0, second.participantCount());
        assertEquals(tournament.getStartTime().minusDays(2).toInstant(), first.draftScheduledAt().toInstant());

        competitionService.joinCompetition(first.competitionId(), alice.getId());
        CompetitionRuleException again = assertThrows(CompetitionRuleException.class,
                () -> competitionService.joinCompetition(first.competitionId(), alice.getId()));
        assertEquals("already_participant", again.getCode());
    }

    @Test
    void privateCompetitionIsJoinedOnlyThroughUnexpiredInvite() {
        Tournament tournament = fixtures.tournament("Invitational", OffsetDateTime.now().plusDays(6), LocalDate.of(2026, 5, 3));
        CompetitionResponses.CompetitionDetail created = competitionService.createPrivateCompetition(
                alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "  Friday Four  "));

        assertEquals("Friday Four", created.name());
        assertFalse(created.publicCompetition());
        assertNotNull(created.inviteCode());
        assertEquals(1, created.participantCount());

        CompetitionRuleException direct = assertThrows(CompetitionRuleException.class,
                () -> competitionService.joinCompetition(created.competitionId(), bob.getId()));
        assertEquals("forbidden", direct.getCode());

        Competition competition = competitionRepository.findById(created.competitionId()).orElseThrow();
        competition.setInviteExpiresAt(OffsetDateTime.now().minusMinutes(1));
        competitionRepository.saveAndFlush(competition);

        CompetitionRuleException expired = assertThrows(CompetitionRuleException.class,
                () -> competitionService.joinByInviteCode(created.inviteCode(), bob.getId()));
        assertEquals("invite_expired", expired.getCode());
        assertEquals(1, competitionService.listParticipants(created.competitionId()).size());
    }

    @Test
    void joiningClosesOnceDraftStarts() {
        Tournament tournament = fixtures.tournament("Masters Week", OffsetDateTime.now().plusDays(6), LocalDate.of(2026, 4, 12));
        CompetitionResponses.CompetitionDetail created = competitionService.createPrivateCompetition(
                alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "Late Entry"));
        competitionService.joinByInviteCode(created.inviteCode(), bob.getId());

        CompetitionRuleException notCreator = assertThrows(CompetitionRuleException.class,
                () -> draftService.startDraft(created.competitionId(), bob.getId(), null));
        assertEquals("forbidden", notCreator.getCode());

        draftService.startDraft(created.competitionId(), alice.getId(), null);
        UserProfile cara = fixtures.user("Cara");

        CompetitionRuleException closed = assertThrows(CompetitionRuleException.class,
                () -> competitionService.joinByInviteCode(created.inviteCode(), cara.getId()));
        assertEquals("draft_already_started", closed.getCode());

        CompetitionRuleException twice = assertThrows(CompetitionRuleException.class,
                () -> draftService.startDraft(created.competitionId(), alice.getId(), null));
        assertEquals("draft_already_started", twice.getCode());
    }

    @Test
    void scheduledDraftStartsWhenCompetitionIsRead() {
        Tournament tournament = fixtures.tournament("Heritage", OffsetDateTime.now().plusHours(36), LocalDate.of(2026, 4, 19));
        CompetitionResponses.CompetitionDetail created = competitionService.createPrivateCompetition(
                alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "Auto"));
        competitionService.joinByInviteCode(created.inviteCode(), bob.getId());

        CompetitionResponses.CompetitionDetail read = competitionService.getCompetition(created.competitionId());

        assertEquals(DraftStatus.IN_PROGRESS, read.draftStatus());
        assertNotNull(read.draftStartedAt());
        assertEquals(2, draftOrderRepository.findByCompetitionIdOrderByPositionAsc(created.competitionId()).size());
        assertFalse(draftService.maybeAutoStartDraft(created.competitionId()));
    }

    @Test
    void scheduledDraftWaitsForSecondParticipant() {
        Tournament tournament = fixtures.tournament("Zurich", OffsetDateTime.now().plusHours(36), LocalDate.of(2026, 4, 26));
        CompetitionResponses.CompetitionDetail created = competitionService.createPrivateCompetition(
                alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "Solo"));

        assertEquals(DraftStatus.NOT_STARTED, competitionService.getCompetition(created.competitionId()).draftStatus());
    }

    @Test
    void scheduledDraftIsSuppressedCloseToTeeTime() {
        Tournament tournament = fixtures.tournament("Byron Nelson", OffsetDateTime.now().plusHours(3), LocalDate.of(2026, 5, 3));
        CompetitionResponses.CompetitionDetail created = competitionService.createPrivateCompetition(
                alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "Last Minute"));
        competitionService.joinByInviteCode(created.inviteCode(), bob.getId());

        assertFalse(draftService.maybeAutoStartDraft(created.competitionId()));
        assertEquals(DraftStatus.NOT_STARTED, competitionService.getCompetition(created.competitionId()).draftStatus());
        assertTrue(draftOrderRepository.findByCompetitionIdOrderByPositionAsc(created.competitionId()).isEmpty());
    }

    @Test
    void startedTournamentRejectsNewCompetitions() {
        Tournament tournament = fixtures.tournament("Underway", OffsetDateTime.now().minusHours(1), LocalDate.of(2026, 7, 19));

        CompetitionRuleException started = assertThrows(CompetitionRuleException.class,
                () -> competitionService.createPrivateCompetition(
                        alice.getId(), new CompetitionRequests.CreateCompetitionRequest(tournament.getId(), "Too Late")));
        assertEquals("tournament_started", started.getCode());
    }

    @Test
    void unknownCompetitionIsNotFound() {
        UUID missing = UUID.randomUUID();

        assertThrows(ResponseStatusException.class,
                () -> competitionService.listParticipants(missing));
    }
}
