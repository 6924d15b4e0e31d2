package com.golfdraft.service;

import com.golfdraft.dto.CompetitionRequests;
import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.dto.TournamentResultRequests;
import com.golfdraft.model.AnnualAggregate;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.DraftOrderMode;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentStatus;
import com.golfdraft.model.UserProfile;
import com.golfdraft.repository.AnnualAggregateRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Several competitions on one tournament share a player; finalizing them at the same time must
 * add every competition to that player's season row. Runs without a test transaction so each
 * finalization commits on its own.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class ConcurrentFinalizationIntegrationTest {

    private static final int SEASON = 2031;
    private static final int COMPETITIONS = 3;

    @Autowired
    private CompetitionService competitionService;

    @Autowired
    private DraftService draftService;

    @Autowired
    private TournamentResultService tournamentResultService;

    @Autowired
    private CompetitionFinalizationService competitionFinalizationService;

    @Autowired
    private UserProfileRepository userProfileRepository;

    @Autowired
    private GolferRepository golferRepository;

    @Autowired
    private TournamentRepository tournamentRepository;

    @Autowired
    private CompetitionScoreRepository competitionScoreRepository;

    @Autowired
    private AnnualAggregateRepository annualAggregateRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final List<UUID> userIds = new ArrayList<>();
    private final List<UUID> golferIds = new ArrayList<>();
    private final List<UUID> competitionIds = new ArrayList<>();
    private UUID tournamentId;
    private UUID sharedUserId;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        GolfDraftFixtures fixtures = new GolfDraftFixtures(userProfileRepository, golferRepository, tournamentRepository);
        UserProfile shared = fixtures.user("Regular");
        sharedUserId = shared.getId();
        userIds.add(sharedUserId);
        for (Golfer golfer : fixtures.golfers("Field", 6)) {
            golferIds.add(golfer.getId());
        }
        Tournament tournament = fixtures.tournament("Season Finale", OffsetDateTime.now().plusDays(4), LocalDate.of(SEASON, 9, 14));
        tournamentId = tournament.getId();

        for (int i = 1; i <= COMPETITIONS; i++) {
            UserProfile host = fixtures.user("Host " + i);
            userIds.add(host.getId());
            CompetitionResponses.CompetitionDetail competition = competitionService.createPrivateCompetition(
                    host.getId(), new CompetitionRequests.CreateCompetitionRequest(tournamentId, "Side Game " + i));
            competitionIds.add(competition.competitionId());
            competitionService.joinByInviteCode(competition.inviteCode(), sharedUserId);
            draftService.startDraft(competition.competitionId(), host.getId(), DraftOrderMode.RANDOM);
            for (UUID golferId : golferIds) {
                DraftResponses.CurrentTurn turn = draftService.getCurrentTurn(competition.competitionId());
                draftService.makePick(competition.competitionId(), turn.userId(), golferId);
            }
        }

        List<TournamentResultRequests.GolferResultSnapshot> results = new ArrayList<>();
        for (int i = 0; i < golferIds.size(); i++) {
            int toPar = i - 3;
            results.add(new TournamentResultRequests.GolferResultSnapshot(
                    golferIds.get(i), i + 1, 280 + toPar, toPar, true, false, List.of(toPar, 0, 0, 0)));
        }
        tournamentResultService.ingestSnapshot(tournamentId, new TournamentResultRequests.ResultsSnapshotRequest(
                TournamentStatus.COMPLETED, false, results));

        executor = Executors.newFixedThreadPool(COMPETITIONS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
        for (UUID competitionId : competitionIds) {
            jdbcTemplate.update("DELETE FROM competition_bounties WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM competition_payments WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM competition_scores WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM alternates WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM draft_picks WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM draft_order WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM competition_participants WHERE competition_id = ?", competitionId);
            jdbcTemplate.update("DELETE FROM competitions WHERE id = ?", competitionId);
        }
        if (tournamentId != null) {
            jdbcTemplate.update("DELETE FROM tournament_results WHERE tournament_id = ?", tournamentId);
            jdbcTemplate.update("DELETE FROM tournaments WHERE id = ?", tournamentId);
        }
        for (UUID golferId : golferIds) {
            jdbcTemplate.update("DELETE FROM golfers WHERE id = ?", golferId);
        }
        for (UUID userId : userIds) {
            jdbcTemplate.update("DELETE FROM annual_leaderboard WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM user_profiles WHERE id = ?", userId);
        }
    }

    @Test
    void simultaneousFinalizationsAddEveryCompetitionToExistingSeason() throws Exception {
        AnnualAggregate prior = new AnnualAggregate();
        prior.setId(UUID.randomUUID());
        prior.setUserId(sharedUserId);
        prior.setYear(SEASON);
        prior.setTotalCompetitions(1);
        prior.setTotalWinnings(new BigDecimal("5.00"));
        annualAggregateRepository.save(prior);

        List<FinalizationOutcome> outcomes = finalizeAllAtOnce();

        assertEquals(List.of(FinalizationOutcome.FINALIZED, FinalizationOutcome.FINALIZED, FinalizationOutcome.FINALIZED),
                outcomes);
        assertSharedSeason(1 + COMPETITIONS, new BigDecimal("5.00"));
    }

    @Test
    void simultaneousFinalizationsCreateSingleSeasonRow() throws Exception {
        List<FinalizationOutcome> outcomes = finalizeAllAtOnce();

        assertEquals(COMPETITIONS, outcomes.stream().filter(FinalizationOutcome.FINALIZED::equals).count());
        assertSharedSeason(COMPETITIONS, BigDecimal.ZERO);
        for (UUID hostId : userIds.subList(1, userIds.size())) {
            assertEquals(1, annualAggregateRepository.findByUserIdAndYear(hostId, SEASON).orElseThrow().getTotalCompetitions());
        }
    }

    private void assertSharedSeason(int competitions, BigDecimal priorWinnings) {
        List<CompetitionScore> scores = competitionScoreRepository.findByUserId(sharedUserId);
        assertEquals(COMPETITIONS, scores.size());
        BigDecimal expectedWinnings = scores.stream()
                .map(CompetitionScore::getNetWinnings)
                .reduce(priorWinnings, BigDecimal::add);
        long wins = scores.stream().filter(score -> score.getFinalPosition() == 1).count();

        AnnualAggregate aggregate = annualAggregateRepository.findByUserIdAndYear(sharedUserId, SEASON).orElseThrow();
        assertEquals(competitions, aggregate.getTotalCompetitions());
        assertEquals(wins, aggregate.getCompetitionsWon().longValue());
        assertEquals(0, expectedWinnings.compareTo(aggregate.getTotalWinnings()),
                () -> "expected " + expectedWinnings + " but was " + aggregate.getTotalWinnings());
    }

    private List<FinalizationOutcome> finalizeAllAtOnce() throws InterruptedException {
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<FinalizationOutcome>> futures = new ArrayList<>();
        for (UUID competitionId : competitionIds) {
            futures.add(executor.submit(() -> {
                startGate.await();
                return competitionFinalizationService.finalizeCompetition(competitionId);
            }));
        }
        startGate.countDown();

        List<FinalizationOutcome> outcomes = new ArrayList<>();
        for (Future<FinalizationOutcome> future : futures) {
            try {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            } catch (ExecutionException ex) {
                throw new AssertionError("Finalization failed", ex.getCause());
            } catch (TimeoutException ex) {
                throw new AssertionError("Finalization did not finish", ex);
            }
        }
        return outcomes;
    }
}
