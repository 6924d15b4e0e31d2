package com.golfdraft.dto;

import com.golfdraft.model.DraftStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class DraftResponses {

    private DraftResponses() {
    }

    public record DraftOrderSlot(
            UUID userId,
            int position
    ) {
    }

    public record Pick(
            UUID pickId,
            UUID userId,
            UUID golferId,
            String golferName,
            int draftRound,
            int pickNumber,
            OffsetDateTime pickedAt
    ) {
    }

    public record AlternateSelection(
            UUID userId,
            UUID golferId,
            String golferName,
            OffsetDateTime selectedAt
    ) {
    }

    /**
     * {@code userId} and {@code round} are {@code null} when no pick is due (draft not running or
     * complete); {@code pickNumber} is always {@code picksMade + 1}.
     */
    public record CurrentTurn(
            UUID competitionId,
            DraftStatus draftStatus,
            UUID userId,
            Integer pickNumber,
            Integer round,
            int picksMade,
            int totalPicks
    ) {
    }
}
