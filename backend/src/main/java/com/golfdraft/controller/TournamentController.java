package com.golfdraft.controller;

import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.dto.TournamentResultRequests;
import com.golfdraft.dto.TournamentResultResponses;
import com.golfdraft.service.CompetitionService;
import com.golfdraft.service.TournamentResultService;
import com.golfdraft.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments/{tournamentId}")
public class TournamentController {

    private final CompetitionService competitionService;
    private final TournamentResultService tournamentResultService;

    public TournamentController(
            CompetitionService competitionService,
            TournamentResultService tournamentResultService
    ) {
        this.competitionService = competitionService;
        this.tournamentResultService = tournamentResultService;
    }

    @PostMapping("/public-competition")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> getOrCreatePublicCompetition(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID tournamentId
    ) {
        return ResponseEntity.ok(competitionService.getOrCreatePublicCompetition(callerId, tournamentId));
    }

    @GetMapping("/results")
    public ResponseEntity<List<TournamentResultResponses.ResultDetail>> getResults(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentResultService.getResults(tournamentId));
    }

    @PutMapping("/results")
    public ResponseEntity<TournamentResultResponses.SnapshotIngestion> ingestResults(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentResultRequests.ResultsSnapshotRequest request
    ) {
        return ResponseEntity.ok(tournamentResultService.ingestSnapshot(tournamentId, request));
    }
}
