package com.golfdraft.repository;

import com.golfdraft.model.Competition;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.RoundToParJsonCodec;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Transactional
class GolfDraftRepositorySmokeTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private GolferRepository golferRepository;

    @Autowired
    private TournamentRepository tournamentRepository;

    @Autowired
    private TournamentResultRepository tournamentResultRepository;

    @Autowired
    private CompetitionRepository competitionRepository;

    @Autowired
    private DraftPickRepository draftPickRepository;

    @Test
    void flywayCreatesDraftAndScoringTables() {
        Integer tableCount = jdbcTemplate.queryForObject(
                """
                        SELECT COUNT(*)
                        FROM information_schema.tables
                        WHERE table_schema = 'public'
                          AND table_name IN (
                              'user_profiles', 'golfers', 'tournaments', 'tournament_results',
                              'competitions', 'competition_participants', 'draft_order', 'draft_picks',
                              'alternates', 'competition_scores', 'competition_payments',
                              'competition_bounties', 'annual_leaderboard'
                          )
                        """,
                Integer.class
        );
        assertEquals(13, tableCount);
    }

    @Test
    void tournamentResultRoundTripsRoundScores() {
        Tournament tournament = createTournament();
        Golfer golfer = createGolfer("Round Tripper");

        TournamentResult result = new TournamentResult();
        result.setId(UUID.randomUUID());
        result.setTournamentId(tournament.getId());
        result.setGolferId(golfer.getId());
        result.setPosition(7);
        result.setTotalStrokes(139);
        result.setTotalToPar(-3);
        result.setMadeCut(false);
        result.setRoundToParJson(RoundToParJsonCodec.toJson(List.of(-4, 1)));
        tournamentResultRepository.saveAndFlush(result);

        TournamentResult reloaded = tournamentResultRepository
                .findByTournamentIdAndGolferId(tournament.getId(), golfer.getId())
                .orElseThrow();
        assertEquals(List.of(-4, 1), RoundToParJsonCodec.fromJson(reloaded.getRoundToParJson()));
        assertEquals(Boolean.FALSE, reloaded.getMadeCut());
        assertEquals(1, tournamentResultRepository.findByTournamentIdAndPosition(tournament.getId(), 7).size());
    }

    @Test
    void golferCanBeDraftedOncePerCompetition() {
        Tournament tournament = createTournament();
        Golfer golfer = createGolfer("Popular Pick");
        Competition competition = createCompetition(tournament);

        draftPickRepository.saveAndFlush(pick(competition.getId(), golfer.getId(), 1));

        assertThrows(DataIntegrityViolationException.class,
                () -> draftPickRepository.saveAndFlush(pick(competition.getId(), golfer.getId(), 2)));
    }

    @Test
    void lockedCompetitionReadFindsRow() {
        Competition competition = createCompetition(createTournament());

        assertTrue(competitionRepository.findByIdForUpdate(competition.getId()).isPresent());
        assertTrue(competitionRepository.findByIdForUpdate(UUID.randomUUID()).isEmpty());
    }

    private Tournament createTournament() {
        Tournament tournament = new Tournament();
        tournament.setId(UUID.randomUUID());
        tournament.setExternalId("smoke-" + UUID.randomUUID());
        tournament.setName("Smoke Open");
        tournament.setStartTime(OffsetDateTime.now().plusDays(3));
        tournament.setEndDate(LocalDate.of(2026, 9, 13));
        return tournamentRepository.saveAndFlush(tournament);
    }

    private Golfer createGolfer(String name) {
        Golfer golfer = new Golfer();
        golfer.setId(UUID.randomUUID());
        golfer.setExternalId("smoke-" + UUID.randomUUID());
        golfer.setDisplayName(name);
        return golferRepository.saveAndFlush(golfer);
    }

    private Competition createCompetition(Tournament tournament) {
        Competition competition = new Competition();
        competition.setId(UUID.randomUUID());
        competition.setTournamentId(tournament.getId());
        competition.setName("Smoke Draft");
        competition.setCreatedBy(UUID.randomUUID());
        competition.setPublicCompetition(true);
        competition.setDraftScheduledAt(tournament.getStartTime().minusDays(2));
        return competitionRepository.saveAndFlush(competition);
    }

    private static DraftPick pick(UUID competitionId, UUID golferId, int pickNumber) {
        DraftPick pick = new DraftPick();
        pick.setId(UUID.randomUUID());
        pick.setCompetitionId(competitionId);
        pick.setUserId(UUID.randomUUID());
        pick.setGolferId(golferId);
        pick.setDraftRound(1);
        pick.setPickNumber(pickNumber);
        return pick;
    }
}
