package com.golfdraft.service;

import java.util.UUID;

/**
 * A participant's alternate as seen while resolving their picks in pick order.
 * Consuming it yields a new state; the alternate covers at most one withdrawal.
 */
public record AlternateState(
        UUID golferId,
        GolferResult result,
        boolean consumed
) {

    private static final AlternateState NONE = new AlternateState(null, null, false);

    public static AlternateState none() {
        return NONE;
    }

    public static AlternateState available(UUID golferId, GolferResult result) {
        return new AlternateState(golferId, result, false);
    }

    public boolean eligible() {
        return golferId != null
                && !consumed
                && result != null
                && !result.effectivelyWithdrawn()
                && result.totalToPar() != null;
    }

    public AlternateState consume() {
        return new AlternateState(golferId, result, true);
    }
}
