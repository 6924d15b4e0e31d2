package com.golfdraft.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public final class SeasonResponses {

    private SeasonResponses() {
    }

    public record AnnualStanding(
            int rank,
            UUID userId,
            String displayName,
            String teamColor,
            int year,
            int totalCompetitions,
            int competitionsWon,
            BigDecimal totalWinnings,
            BigDecimal totalBounties,
            BigDecimal totalNet
    ) {
    }

    public record CompetitionHistoryItem(
            UUID competitionId,
            String competitionName,
            boolean publicCompetition,
            UUID tournamentId,
            String tournamentName,
            LocalDate tournamentEndDate,
            int finalPosition,
            int teamScoreToPar,
            int participantCount,
            BigDecimal netWinnings,
            BigDecimal netBounties
    ) {
    }
}
