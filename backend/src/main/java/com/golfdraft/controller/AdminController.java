package com.golfdraft.controller;

import com.golfdraft.dto.AdminRequests;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.dto.TournamentResultResponses;
import com.golfdraft.service.CompetitionAdminService;
import com.golfdraft.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final CompetitionAdminService competitionAdminService;

    public AdminController(CompetitionAdminService competitionAdminService) {
        this.competitionAdminService = competitionAdminService;
    }

    @PostMapping("/competitions/{competitionId}/finalization/reset")
    public ResponseEntity<Map<String, Boolean>> resetFinalization(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId
    ) {
        boolean reset = competitionAdminService.resetFinalization(callerId, competitionId);
        return ResponseEntity.ok(Map.of("reset", reset));
    }

    @PostMapping("/competitions/{competitionId}/draft/reset")
    public ResponseEntity<Void> resetDraft(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId
    ) {
        competitionAdminService.resetDraft(callerId, competitionId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/competitions/{competitionId}/picks/{pickId}")
    public ResponseEntity<DraftResponses.Pick> swapPick(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @PathVariable UUID pickId,
            @Valid @RequestBody AdminRequests.SwapPickRequest request
    ) {
        return ResponseEntity.ok(competitionAdminService.swapPick(callerId, competitionId, pickId, request.golferId()));
    }

    @PutMapping("/competitions/{competitionId}/alternates/{userId}")
    public ResponseEntity<DraftResponses.AlternateSelection> updateAlternate(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @PathVariable UUID userId,
            @Valid @RequestBody AdminRequests.UpdateAlternateRequest request
    ) {
        return ResponseEntity.ok(
                competitionAdminService.updateAlternate(callerId, competitionId, userId, request.golferId()));
    }

    @DeleteMapping("/competitions/{competitionId}/participants/{userId}")
    public ResponseEntity<Void> removeParticipant(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @PathVariable UUID userId
    ) {
        competitionAdminService.removeParticipant(callerId, competitionId, userId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/tournaments/{tournamentId}/results/{golferId}")
    public ResponseEntity<TournamentResultResponses.ResultDetail> editResult(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID tournamentId,
            @PathVariable UUID golferId,
            @Valid @RequestBody AdminRequests.EditResultRequest request
    ) {
        return ResponseEntity.ok(competitionAdminService.editResult(callerId, tournamentId, golferId, request));
    }
}
