package com.golfdraft.controller;

import com.golfdraft.dto.CompetitionRequests;
import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.service.CompetitionService;
import com.golfdraft.web.CallerHeaders;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionController {

    private final CompetitionService competitionService;

    public CompetitionController(CompetitionService competitionService) {
        this.competitionService = competitionService;
    }

    @PostMapping
    public ResponseEntity<CompetitionResponses.CompetitionDetail> createCompetition(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @Valid @RequestBody CompetitionRequests.CreateCompetitionRequest request
    ) {
        CompetitionResponses.CompetitionDetail competition =
                competitionService.createPrivateCompetition(callerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(competition);
    }

    @GetMapping("/{competitionId}")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> getCompetition(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(competitionService.getCompetition(competitionId));
    }

    @GetMapping("/{competitionId}/participants")
    public ResponseEntity<List<CompetitionResponses.Participant>> listParticipants(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(competitionService.listParticipants(competitionId));
    }

    @PostMapping("/{competitionId}/participants")
    public ResponseEntity<CompetitionResponses.Participant> joinCompetition(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(competitionService.joinCompetition(competitionId, callerId));
    }

    @PostMapping("/invites/{inviteCode}")
    public ResponseEntity<CompetitionResponses.Participant> joinByInvite(
            @RequestHeader(CallerHeaders.USER_ID) UUID callerId,
            @PathVariable String inviteCode
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(competitionService.joinByInviteCode(inviteCode, callerId));
    }
}
