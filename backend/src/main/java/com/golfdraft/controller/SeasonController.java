package com.golfdraft.controller;

import com.golfdraft.dto.SeasonResponses;
import com.golfdraft.service.AnnualLeaderboardService;
import com.golfdraft.service.CompetitionHistoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class SeasonController {

    private final AnnualLeaderboardService annualLeaderboardService;
    private final CompetitionHistoryService competitionHistoryService;

    public SeasonController(
            AnnualLeaderboardService annualLeaderboardService,
            CompetitionHistoryService competitionHistoryService
    ) {
        this.annualLeaderboardService = annualLeaderboardService;
        this.competitionHistoryService = competitionHistoryService;
    }

    @GetMapping("/annual-leaderboard/{year}")
    public ResponseEntity<List<SeasonResponses.AnnualStanding>> getAnnualLeaderboard(@PathVariable int year) {
        return ResponseEntity.ok(annualLeaderboardService.getAnnualLeaderboard(year));
    }

    @GetMapping("/users/{userId}/annual-stats/{year}")
    public ResponseEntity<SeasonResponses.AnnualStanding> getAnnualStats(
            @PathVariable UUID userId,
            @PathVariable int year
    ) {
        return ResponseEntity.ok(annualLeaderboardService.getAnnualStats(userId, year));
    }

    @GetMapping("/users/{userId}/competition-history")
    public ResponseEntity<List<SeasonResponses.CompetitionHistoryItem>> getCompetitionHistory(
            @PathVariable UUID userId,
            @RequestParam(name = "public", required = false) Boolean publicFilter,
            @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(competitionHistoryService.getHistory(userId, publicFilter, limit));
    }
}
