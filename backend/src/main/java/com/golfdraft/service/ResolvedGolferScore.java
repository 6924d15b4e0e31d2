package com.golfdraft.service;

import java.util.UUID;

/**
 * Outcome of resolving one drafted golfer.
 *
 * @param golferId          the drafted golfer
 * @param scoreToPar        counted contribution; {@code null} while a withdrawal penalty is pending
 * @param strokes           stroke total of the golfer actually counted
 * @param usedAlternate     the alternate's score stands in for this pick
 * @param alternateGolferId the alternate that was substituted
 * @param missedCut         the counted score carries the missed-cut penalty
 * @param withdrew          the drafted golfer is effectively withdrawn
 */
public record ResolvedGolferScore(
        UUID golferId,
        Integer scoreToPar,
        Integer strokes,
        boolean usedAlternate,
        UUID alternateGolferId,
        boolean missedCut,
        boolean withdrew
) {

    public boolean penaltyPending() {
        return scoreToPar == null;
    }

    public ResolvedGolferScore withPenalty(int penalty) {
        return new ResolvedGolferScore(golferId, penalty, null, false, null, false, true);
    }
}
