package com.golfdraft.controller;

import com.golfdraft.dto.CompetitionRequests;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.service.DraftService;
import com.golfdraft.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
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
@RequestMapping("/api/competitions/{competitionId}/draft")
public class DraftController {

    private final DraftService draftService;

    public DraftController(DraftService draftService) {
        this.draftService = draftService;
    }

    @PostMapping("/start")
    public ResponseEntity<List<DraftResponses.DraftOrderSlot>> startDraft(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @RequestBody(required = false) CompetitionRequests.StartDraftRequest request
    ) {
        List<DraftResponses.DraftOrderSlot> order = draftService.startDraft(
                competitionId,
                callerId,
                request == null ? null : request.orderMode()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }

    @GetMapping("/order")
    public ResponseEntity<List<DraftResponses.DraftOrderSlot>> getDraftOrder(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(draftService.getDraftOrder(competitionId));
    }

    @GetMapping("/turn")
    public ResponseEntity<DraftResponses.CurrentTurn> getCurrentTurn(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(draftService.getCurrentTurn(competitionId));
    }

    @GetMapping("/picks")
    public ResponseEntity<List<DraftResponses.Pick>> getDraftPicks(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(draftService.getDraftPicks(competitionId));
    }

    @PostMapping("/picks")
    public ResponseEntity<DraftResponses.Pick> makePick(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @Valid @RequestBody CompetitionRequests.MakePickRequest request
    ) {
        DraftResponses.Pick pick = draftService.makePick(competitionId, callerId, request.golferId());
        return ResponseEntity.status(HttpStatus.CREATED).body(pick);
    }

    @GetMapping("/alternates")
    public ResponseEntity<List<DraftResponses.AlternateSelection>> getAlternates(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(draftService.getAlternates(competitionId));
    }

    @PutMapping("/alternate")
    public ResponseEntity<DraftResponses.AlternateSelection> selectAlternate(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId,
            @Valid @RequestBody CompetitionRequests.SelectAlternateRequest request
    ) {
        return ResponseEntity.ok(draftService.selectAlternate(competitionId, callerId, request.golferId()));
    }
}
