package com.golfdraft.service;

import com.golfdraft.model.DraftPick;
import com.golfdraft.model.PaymentType;
import com.golfdraft.model.TournamentStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drafting the tournament winner earns a bounty scaled by the round it was picked in:
 * the bottom {@code round} teams each pay one tier.
 */
@Component
public class BountyCalculator {

    public Optional<BountyPlan> calculate(
            TournamentStatus tournamentStatus,
            List<DraftPick> picks,
            Map<UUID, GolferResult> resultsByGolfer,
            List<LeaderboardEntry> leaderboard,
            BigDecimal bountyPerTier
    ) {
        if (tournamentStatus != TournamentStatus.COMPLETED) {
            return Optional.empty();
        }

        Optional<DraftPick> winningPick = picks.stream()
                .filter(pick -> {
                    GolferResult result = resultsByGolfer.get(pick.getGolferId());
                    return result != null && Integer.valueOf(1).equals(result.position());
                })
                .min(Comparator.comparingInt(DraftPick::getPickNumber));
        if (winningPick.isEmpty()) {
            return Optional.empty();
        }

        DraftPick pick = winningPick.get();
        UUID winnerUserId = pick.getUserId();
        boolean winnerRanked = leaderboard.stream().anyMatch(entry -> entry.userId().equals(winnerUserId));
        if (!winnerRanked) {
            return Optional.empty();
        }

        int tier = pick.getDraftRound();
        BigDecimal perTier = bountyPerTier.setScale(PaymentCalculator.MONEY_SCALE, RoundingMode.HALF_UP);

        List<LeaderboardEntry> worstFirst = new ArrayList<>(leaderboard);
        worstFirst.sort(Comparator.comparingInt(LeaderboardEntry::position).reversed());

        List<PaymentTransfer> payments = new ArrayList<>();
        for (LeaderboardEntry payer : worstFirst.subList(0, Math.min(tier, worstFirst.size()))) {
            if (payer.userId().equals(winnerUserId)) {
                continue;
            }
            payments.add(new PaymentTransfer(payer.userId(), winnerUserId, perTier, PaymentType.BOUNTY));
        }

        BigDecimal bountyAmount = payments.stream()
                .map(PaymentTransfer::amount)
                .reduce(BigDecimal.ZERO.setScale(PaymentCalculator.MONEY_SCALE), BigDecimal::add);

        return Optional.of(new BountyPlan(winnerUserId, pick.getGolferId(), tier, bountyAmount, List.copyOf(payments)));
    }

    public record BountyPlan(
            UUID winnerUserId,
            UUID golferId,
            int pickRound,
            BigDecimal bountyAmount,
            List<PaymentTransfer> payments
    ) {
    }
}
