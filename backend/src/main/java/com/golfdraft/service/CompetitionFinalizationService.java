package com.golfdraft.service;

import com.golfdraft.config.GolfDraftProperties;
import com.golfdraft.model.AnnualAggregate;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionBounty;
import com.golfdraft.model.CompetitionPayment;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.PaymentType;
import com.golfdraft.model.ScoreBreakdownJsonCodec;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentStatus;
import com.golfdraft.repository.AnnualAggregateRepository;
import com.golfdraft.repository.CompetitionBountyRepository;
import com.golfdraft.repository.CompetitionPaymentRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Freezes a competition's standings and money once its tournament is complete, and takes
 * them back again on administrative reset. Both run under the competition row lock, so the
 * "already finalized" check and the annual deltas are applied atomically. Season rows are
 * changed only while the owning users' rows are locked.
 */
@Service
public class CompetitionFinalizationService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionFinalizationService.class);
    private static final BigDecimal ZERO_MONEY = BigDecimal.ZERO.setScale(PaymentCalculator.MONEY_SCALE);

    private final CompetitionRepository competitionRepository;
    private final TournamentRepository tournamentRepository;
    private final CompetitionScoreRepository competitionScoreRepository;
    private final CompetitionPaymentRepository competitionPaymentRepository;
    private final CompetitionBountyRepository competitionBountyRepository;
    private final AnnualAggregateRepository annualAggregateRepository;
    private final UserProfileRepository userProfileRepository;
    private final CompetitionStandingsLoader competitionStandingsLoader;
    private final PaymentCalculator paymentCalculator;
    private final BountyCalculator bountyCalculator;
    private final GolfDraftProperties golfDraftProperties;

    public CompetitionFinalizationService(
            CompetitionRepository competitionRepository,
            TournamentRepository tournamentRepository,
            CompetitionScoreRepository competitionScoreRepository,
            CompetitionPaymentRepository competitionPaymentRepository,
            CompetitionBountyRepository competitionBountyRepository,
            AnnualAggregateRepository annualAggregateRepository,
            UserProfileRepository userProfileRepository,
            CompetitionStandingsLoader competitionStandingsLoader,
            PaymentCalculator paymentCalculator,
            BountyCalculator bountyCalculator,
            GolfDraftProperties golfDraftProperties
    ) {
        this.competitionRepository = competitionRepository;
        this.tournamentRepository = tournamentRepository;
        this.competitionScoreRepository = competitionScoreRepository;
        this.competitionPaymentRepository = competitionPaymentRepository;
        this.competitionBountyRepository = competitionBountyRepository;
        this.annualAggregateRepository = annualAggregateRepository;
        this.userProfileRepository = userProfileRepository;
        this.competitionStandingsLoader = competitionStandingsLoader;
        this.paymentCalculator = paymentCalculator;
        this.bountyCalculator = bountyCalculator;
        this.golfDraftProperties = golfDraftProperties;
    }

    @Transactional
    public FinalizationOutcome finalizeCompetition(UUID competitionId) {
        Competition competition = lockCompetition(competitionId);
        if (competitionScoreRepository.existsByCompetitionId(competitionId)) {
            log.debug("Competition {} already finalized", competitionId);
            return FinalizationOutcome.ALREADY_FINALIZED;
        }

        Tournament tournament = tournamentRepository.findById(competition.getTournamentId())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + competition.getTournamentId()
                ));
        if (tournament.getStatus() != TournamentStatus.COMPLETED || competition.getDraftStatus() != DraftStatus.COMPLETED) {
            return FinalizationOutcome.NOT_READY;
        }

        CompetitionStandingsLoader.Standings standings = competitionStandingsLoader.load(competition);
        List<LeaderboardEntry> leaderboard = standings.leaderboard();
        if (leaderboard.isEmpty()) {
            log.debug("Competition {} has no scored teams yet", competitionId);
            return FinalizationOutcome.NOT_READY;
        }

        OffsetDateTime now = OffsetDateTime.now();
        List<PaymentTransfer> transfers = new ArrayList<>(paymentCalculator.calculateMainPayments(leaderboard));
        Optional<BountyCalculator.BountyPlan> bounty = bountyCalculator.calculate(
                tournament.getStatus(),
                standings.picks(),
                standings.resultsByGolfer(),
                leaderboard,
                golfDraftProperties.getScoring().getBountyPerTier()
        );
        bounty.ifPresent(plan -> transfers.addAll(plan.payments()));

        competitionPaymentRepository.saveAll(transfers.stream()
                .map(transfer -> toPayment(competitionId, transfer, now))
                .toList());
        bounty.ifPresent(plan -> competitionBountyRepository.save(toBounty(competitionId, plan, now)));

        Map<UUID, BigDecimal> netWinnings = paymentCalculator.netBalances(transfers, PaymentType.MAIN);
        Map<UUID, BigDecimal> netBounties = paymentCalculator.netBalances(transfers, PaymentType.BOUNTY);
        int year = tournament.getEndDate().getYear();

        List<CompetitionScore> scores = new ArrayList<>(leaderboard.size());
        for (LeaderboardEntry entry : leaderboard) {
            CompetitionScore score = new CompetitionScore();
            score.setId(UUID.randomUUID());
            score.setCompetitionId(competitionId);
            score.setUserId(entry.userId());
            score.setTeamScoreToPar(entry.teamScoreToPar());
            score.setTeamScoreStrokes(entry.teamScoreStrokes());
            score.setFinalPosition(entry.position());
            score.setScoreBreakdownJson(ScoreBreakdownJsonCodec.toJson(entry.breakdown()));
            score.setAggregateYear(year);
            score.setNetWinnings(netWinnings.getOrDefault(entry.userId(), ZERO_MONEY));
            score.setNetBounties(netBounties.getOrDefault(entry.userId(), ZERO_MONEY));
            score.setCalculatedAt(now);
            scores.add(score);
        }
        competitionScoreRepository.saveAll(scores);

        lockSeasonOwners(scores);
        for (CompetitionScore score : scores) {
            applyToAnnualAggregate(score, now);
        }

        log.info("Finalized competition {}: {} teams, {} payments, bounty {}",
                competitionId, scores.size(), transfers.size(), bounty.isPresent() ? "awarded" : "none");
        return FinalizationOutcome.FINALIZED;
    }

    /**
     * Takes back everything {@link #finalizeCompetition(UUID)} wrote. Returns {@code false} when the
     * competition was not finalized.
     */
    @Transactional
    public boolean resetFinalization(UUID competitionId) {
        lockCompetition(competitionId);
        List<CompetitionScore> scores = competitionScoreRepository.findByCompetitionIdOrderByFinalPositionAsc(competitionId);
        if (scores.isEmpty()) {
            log.debug("Competition {} has no finalization to reset", competitionId);
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now();
        lockSeasonOwners(scores);
        for (CompetitionScore score : scores) {
            revertAnnualAggregate(score, now);
        }

        competitionBountyRepository.deleteByCompetitionId(competitionId);
        competitionPaymentRepository.deleteByCompetitionId(competitionId);
        competitionScoreRepository.deleteByCompetitionId(competitionId);
        // Deletes must reach the database before a re-finalization in the same transaction inserts again.
        competitionScoreRepository.flush();

        log.info("Reset finalization of competition {} ({} scores reverted)", competitionId, scores.size());
        return true;
    }

    // Season rows are shared across competitions; these user locks are held until commit.
    private void lockSeasonOwners(List<CompetitionScore> scores) {
        userProfileRepository.findByIdInForUpdate(scores.stream().map(CompetitionScore::getUserId).toList());
    }

    private void applyToAnnualAggregate(CompetitionScore score, OffsetDateTime now) {
        AnnualAggregate aggregate = annualAggregateRepository
                .findByUserIdAndYearForUpdate(score.getUserId(), score.getAggregateYear())
                .orElseGet(() -> {
                    AnnualAggregate created = new AnnualAggregate();
                    created.setId(UUID.randomUUID());
                    created.setUserId(score.getUserId());
                    created.setYear(score.getAggregateYear());
                    return created;
                });
        aggregate.setTotalCompetitions(aggregate.getTotalCompetitions() + 1);
        aggregate.setCompetitionsWon(aggregate.getCompetitionsWon() + (score.getFinalPosition() == 1 ? 1 : 0));
        aggregate.setTotalWinnings(aggregate.getTotalWinnings().add(score.getNetWinnings()));
        aggregate.setTotalBounties(aggregate.getTotalBounties().add(score.getNetBounties()));
        aggregate.setUpdatedAt(now);
        annualAggregateRepository.save(aggregate);
    }

    private void revertAnnualAggregate(CompetitionScore score, OffsetDateTime now) {
        Optional<AnnualAggregate> existing =
                annualAggregateRepository.findByUserIdAndYearForUpdate(score.getUserId(), score.getAggregateYear());
        if (existing.isEmpty()) {
            log.warn("No {} annual aggregate for user {} while resetting competition {}",
                    score.getAggregateYear(), score.getUserId(), score.getCompetitionId());
            return;
        }

        AnnualAggregate aggregate = existing.get();
        int remaining = aggregate.getTotalCompetitions() - 1;
        if (remaining <= 0) {
            annualAggregateRepository.delete(aggregate);
            return;
        }
        aggregate.setTotalCompetitions(remaining);
        aggregate.setCompetitionsWon(Math.max(0, aggregate.getCompetitionsWon() - (score.getFinalPosition() == 1 ? 1 : 0)));
        aggregate.setTotalWinnings(aggregate.getTotalWinnings().subtract(score.getNetWinnings()));
        aggregate.setTotalBounties(aggregate.getTotalBounties().subtract(score.getNetBounties()));
        aggregate.setUpdatedAt(now);
        annualAggregateRepository.save(aggregate);
    }

    private static CompetitionPayment toPayment(UUID competitionId, PaymentTransfer transfer, OffsetDateTime now) {
        CompetitionPayment payment = new CompetitionPayment();
        payment.setId(UUID.randomUUID());
        payment.setCompetitionId(competitionId);
        payment.setFromUserId(transfer.fromUserId());
        payment.setToUserId(transfer.toUserId());
        payment.setAmount(transfer.amount());
        payment.setPaymentType(transfer.paymentType());
        payment.setCreatedAt(now);
        return payment;
    }

    private static CompetitionBounty toBounty(UUID competitionId, BountyCalculator.BountyPlan plan, OffsetDateTime now) {
        CompetitionBounty bounty = new CompetitionBounty();
        bounty.setId(UUID.randomUUID());
        bounty.setCompetitionId(competitionId);
        bounty.setUserId(plan.winnerUserId());
        bounty.setGolferId(plan.golferId());
        bounty.setPickRound(plan.pickRound());
        bounty.setBountyAmount(plan.bountyAmount());
        bounty.setCreatedAt(now);
        return bounty;
    }

    private Competition lockCompetition(UUID competitionId) {
        return competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Competition not found: " + competitionId
                ));
    }
}
