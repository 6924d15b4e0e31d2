package com.golfdraft.service;

import com.golfdraft.model.PaymentType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Main-pot settlement: every team behind the winner pays one dollar per stroke of difference,
 * split evenly across winners.
 */
@Component
public class PaymentCalculator {

    static final int MONEY_SCALE = 2;

    public List<PaymentTransfer> calculateMainPayments(List<LeaderboardEntry> leaderboard) {
        List<LeaderboardEntry> winners = leaderboard.stream()
                .filter(entry -> entry.position() == 1)
                .toList();
        if (winners.isEmpty()) {
            return List.of();
        }

        int winningScore = winners.get(0).teamScoreToPar();
        BigDecimal winnerCount = BigDecimal.valueOf(winners.size());

        List<PaymentTransfer> transfers = new ArrayList<>();
        for (LeaderboardEntry loser : leaderboard) {
            if (loser.position() == 1) {
                continue;
            }
            int diff = loser.teamScoreToPar() - winningScore;
            if (diff <= 0) {
                continue;
            }
            BigDecimal share = BigDecimal.valueOf(diff).divide(winnerCount, MONEY_SCALE, RoundingMode.HALF_UP);
            for (LeaderboardEntry winner : winners) {
                transfers.add(new PaymentTransfer(loser.userId(), winner.userId(), share, PaymentType.MAIN));
            }
        }
        return List.copyOf(transfers);
    }

    /**
     * Received minus paid per user, for the given payment type.
     */
    public Map<UUID, BigDecimal> netBalances(Collection<PaymentTransfer> transfers, PaymentType paymentType) {
        Map<UUID, BigDecimal> balances = new LinkedHashMap<>();
        for (PaymentTransfer transfer : transfers) {
            if (transfer.paymentType() != paymentType) {
                continue;
            }
            balances.merge(transfer.toUserId(), transfer.amount(), BigDecimal::add);
            balances.merge(transfer.fromUserId(), transfer.amount().negate(), BigDecimal::add);
        }
        balances.replaceAll((userId, amount) -> amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP));
        return balances;
    }
}
