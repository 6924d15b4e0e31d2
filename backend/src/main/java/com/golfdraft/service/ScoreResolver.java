package com.golfdraft.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Component
public class ScoreResolver {

    public Resolution resolve(UUID golferId, GolferResult result, AlternateState alternate) {
        AlternateState alternateState = alternate == null ? AlternateState.none() : alternate;

        if (result == null || result.effectivelyWithdrawn()) {
            if (alternateState.eligible()) {
                GolferResult alternateResult = alternateState.result();
                ResolvedGolferScore substituted = new ResolvedGolferScore(
                        golferId,
                        countedScore(alternateResult),
                        alternateResult.totalStrokes(),
                        true,
                        alternateState.golferId(),
                        alternateResult.missedCut(),
                        true
                );
                return new Resolution(substituted, alternateState.consume());
            }
            ResolvedGolferScore pending = new ResolvedGolferScore(golferId, null, null, false, null, false, true);
            return new Resolution(pending, alternateState);
        }

        ResolvedGolferScore scored = new ResolvedGolferScore(
                golferId,
                countedScore(result),
                result.totalStrokes(),
                false,
                null,
                result.missedCut(),
                false
        );
        return new Resolution(scored, alternateState);
    }

    /**
     * Missed cut doubles the first two rounds, or the total when fewer than two rounds are known.
     */
    public int countedScore(GolferResult result) {
        if (result.missedCut()) {
            List<Integer> rounds = result.roundToPar();
            if (rounds.size() >= 2) {
                return 2 * (rounds.get(0) + rounds.get(1));
            }
            return 2 * (result.totalToPar() == null ? 0 : result.totalToPar());
        }
        return result.totalToPar() == null ? 0 : result.totalToPar();
    }

    public int withdrawalPenalty(Collection<Integer> otherContributions) {
        int worst = 0;
        for (Integer contribution : otherContributions) {
            if (contribution != null && contribution > worst) {
                worst = contribution;
            }
        }
        return worst + 1;
    }

    public record Resolution(
            ResolvedGolferScore score,
            AlternateState alternateAfter
    ) {
    }
}
