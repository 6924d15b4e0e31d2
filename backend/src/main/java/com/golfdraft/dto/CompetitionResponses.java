package com.golfdraft.dto;

import com.golfdraft.model.DraftStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class CompetitionResponses {

    private CompetitionResponses() {
    }

    public record CompetitionDetail(
            UUID competitionId,
            UUID tournamentId,
            String name,
            UUID createdBy,
            boolean publicCompetition,
            String inviteCode,
            OffsetDateTime inviteExpiresAt,
            DraftStatus draftStatus,
            OffsetDateTime draftScheduledAt,
            OffsetDateTime draftStartedAt,
            OffsetDateTime draftCompletedAt,
            int participantCount,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record Participant(
            UUID userId,
            String displayName,
            String teamColor,
            OffsetDateTime joinedAt
    ) {
    }
}
