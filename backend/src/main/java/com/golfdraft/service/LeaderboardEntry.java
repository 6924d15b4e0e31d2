package com.golfdraft.service;

import com.golfdraft.model.ScoreBreakdownItem;

import java.util.List;
import java.util.UUID;

public record LeaderboardEntry(
        UUID userId,
        int position,
        int teamScoreToPar,
        int teamScoreStrokes,
        List<ScoreBreakdownItem> breakdown
) {

    public LeaderboardEntry {
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
    }
}
