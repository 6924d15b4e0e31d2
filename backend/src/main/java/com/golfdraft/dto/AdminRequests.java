package com.golfdraft.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public final class AdminRequests {

    private AdminRequests() {
    }

    public record SwapPickRequest(
            @NotNull(message = "golferId is required")
            UUID golferId
    ) {
    }

    public record UpdateAlternateRequest(
            @NotNull(message = "golferId is required")
            UUID golferId
    ) {
    }

    /**
     * Partial correction of a result row. {@code null} fields are left unchanged; fields named in
     * {@code clear} are reset to {@code null} (or an empty round list).
     */
    public record EditResultRequest(
            Integer totalToPar,
            Boolean madeCut,
            Boolean withdrew,
            @Min(value = 1, message = "position must be at least 1")
            Integer position,
            @Min(value = 1, message = "totalStrokes must be positive")
            Integer totalStrokes,
            @Size(max = 4, message = "roundToPar has at most 4 rounds")
            List<Integer> roundToPar,
            Set<ResultField> clear
    ) {
    }

    public enum ResultField {
        POSITION,
        TOTAL_STROKES,
        TOTAL_TO_PAR,
        MADE_CUT,
        ROUND_TO_PAR
    }
}
