package com.golfdraft.service;

import com.golfdraft.model.RoundToParJsonCodec;
import com.golfdraft.model.TournamentResult;

import java.util.List;
import java.util.UUID;

/**
 * Normalized tournament outcome for one golfer, the only result shape scoring sees.
 */
public record GolferResult(
        UUID golferId,
        Integer position,
        Integer totalStrokes,
        Integer totalToPar,
        Boolean madeCut,
        boolean withdrew,
        List<Integer> roundToPar
) {

    public GolferResult {
        roundToPar = roundToPar == null ? List.of() : List.copyOf(roundToPar);
    }

    public static GolferResult from(TournamentResult result) {
        return new GolferResult(
                result.getGolferId(),
                result.getPosition(),
                result.getTotalStrokes(),
                result.getTotalToPar(),
                result.getMadeCut(),
                result.isWithdrew(),
                RoundToParJsonCodec.fromJson(result.getRoundToParJson())
        );
    }

    /**
     * A missing to-par only counts as a withdrawal when the golfer is not known to have missed the cut.
     */
    public boolean effectivelyWithdrawn() {
        return withdrew || (totalToPar == null && !Boolean.FALSE.equals(madeCut));
    }

    public boolean missedCut() {
        return Boolean.FALSE.equals(madeCut);
    }
}
