package com.golfdraft.dto;

import com.golfdraft.model.TournamentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class TournamentResultRequests {

    private TournamentResultRequests() {
    }

    /**
     * Normalized snapshot from the results feed.
     *
     * @param tournamentStatus feed status; {@code null} keeps the stored status
     * @param clearOverrides   also overwrite rows an administrator corrected
     */
    public record ResultsSnapshotRequest(
            TournamentStatus tournamentStatus,
            boolean clearOverrides,

            @NotNull(message = "results is required")
            @Valid
            List<GolferResultSnapshot> results
    ) {
    }

    public record GolferResultSnapshot(
            @NotNull(message = "golferId is required")
            UUID golferId,

            @Min(value = 1, message = "position must be at least 1")
            Integer position,

            Integer totalStrokes,
            Integer totalToPar,
            Boolean madeCut,
            boolean withdrew,

            @Size(max = 4, message = "roundToPar has at most 4 rounds")
            List<Integer> roundToPar
    ) {
    }
}
