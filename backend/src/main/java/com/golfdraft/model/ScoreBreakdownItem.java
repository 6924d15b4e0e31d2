package com.golfdraft.model;

import java.util.UUID;

/**
 * How one drafted golfer contributed to a team total.
 *
 * @param golferId          the drafted golfer
 * @param golferName        display name at scoring time
 * @param scoreToPar        contribution counted toward the team total
 * @param strokes           stroke total of the golfer whose score was counted, when known
 * @param usedAlternate     the alternate's score replaced this pick
 * @param alternateGolferId the substituted alternate, when used
 * @param missedCut         the counted score carries the missed-cut penalty
 * @param withdrew          the drafted golfer is treated as withdrawn
 * @param penalized         the withdrawal penalty was applied
 */
public record ScoreBreakdownItem(
        UUID golferId,
        String golferName,
        int scoreToPar,
        Integer strokes,
        boolean usedAlternate,
        UUID alternateGolferId,
        boolean missedCut,
        boolean withdrew,
        boolean penalized
) {
}
