package com.golfdraft.dto;

import com.golfdraft.model.DraftOrderMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public final class CompetitionRequests {

    private CompetitionRequests() {
    }

    public record CreateCompetitionRequest(
            @NotNull(message = "tournamentId is required")
            UUID tournamentId,

            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name
    ) {
    }

    public record StartDraftRequest(
            DraftOrderMode orderMode
    ) {
    }

    public record MakePickRequest(
            @NotNull(message = "golferId is required")
            UUID golferId
    ) {
    }

    public record SelectAlternateRequest(
            @NotNull(message = "golferId is required")
            UUID golferId
    ) {
    }
}
