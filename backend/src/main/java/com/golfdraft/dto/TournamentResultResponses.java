package com.golfdraft.dto;

import com.golfdraft.model.TournamentStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class TournamentResultResponses {

    private TournamentResultResponses() {
    }

    public record SnapshotIngestion(
            UUID tournamentId,
            TournamentStatus tournamentStatus,
            int upserted,
            int skippedOverrides
    ) {
    }

    public record ResultDetail(
            UUID tournamentId,
            UUID golferId,
            Integer position,
            Integer totalStrokes,
            Integer totalToPar,
            Boolean madeCut,
            boolean withdrew,
            List<Integer> roundToPar,
            boolean manualOverride,
            OffsetDateTime lastUpdated
    ) {
    }
}
