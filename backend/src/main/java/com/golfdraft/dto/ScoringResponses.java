package com.golfdraft.dto;

import com.golfdraft.model.PaymentType;
import com.golfdraft.model.ScoreBreakdownItem;
import com.golfdraft.service.FinalizationOutcome;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ScoringResponses {

    private ScoringResponses() {
    }

    /**
     * @param finalized       entries come from the frozen scores
     * @param scoresAvailable the tournament has reported results
     */
    public record Leaderboard(
            UUID competitionId,
            boolean finalized,
            boolean scoresAvailable,
            List<LeaderboardRow> entries
    ) {
    }

    public record LeaderboardRow(
            UUID userId,
            String displayName,
            int position,
            int teamScoreToPar,
            int teamScoreStrokes,
            List<ScoreBreakdownItem> breakdown
    ) {
    }

    public record Payment(
            UUID fromUserId,
            UUID toUserId,
            BigDecimal amount,
            PaymentType paymentType
    ) {
    }

    public record Bounty(
            UUID userId,
            UUID golferId,
            int pickRound,
            BigDecimal bountyAmount,
            OffsetDateTime createdAt
    ) {
    }

    public record Finalization(
            UUID competitionId,
            FinalizationOutcome outcome
    ) {
    }
}
