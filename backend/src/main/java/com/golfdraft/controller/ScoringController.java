package com.golfdraft.controller;

import com.golfdraft.dto.ScoringResponses;
import com.golfdraft.service.CompetitionFinalizationService;
import com.golfdraft.service.CompetitionLeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions/{competitionId}")
public class ScoringController {

    private final CompetitionLeaderboardService competitionLeaderboardService;
    private final CompetitionFinalizationService competitionFinalizationService;

    public ScoringController(
            CompetitionLeaderboardService competitionLeaderboardService,
            CompetitionFinalizationService competitionFinalizationService
    ) {
        this.competitionLeaderboardService = competitionLeaderboardService;
        this.competitionFinalizationService = competitionFinalizationService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<ScoringResponses.Leaderboard> getLeaderboard(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(competitionLeaderboardService.getLeaderboard(competitionId));
    }

    @PostMapping("/finalize")
    public ResponseEntity<ScoringResponses.Finalization> finalizeCompetition(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(new ScoringResponses.Finalization(
                competitionId,
                competitionFinalizationService.finalizeCompetition(competitionId)
        ));
    }

    @GetMapping("/payments")
    public ResponseEntity<List<ScoringResponses.Payment>> getPayments(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(competitionLeaderboardService.getPayments(competitionId));
    }

    @GetMapping("/bounty")
    public ResponseEntity<ScoringResponses.Bounty> getBounty(@PathVariable UUID competitionId) {
        return competitionLeaderboardService.getBounty(competitionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
