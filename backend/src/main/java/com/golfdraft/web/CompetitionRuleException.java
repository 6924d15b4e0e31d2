package com.golfdraft.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A request rejected by competition or draft rules. The code is stable and machine-readable;
 * clients re-fetch state before retrying.
 */
@Getter
public class CompetitionRuleException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public CompetitionRuleException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static CompetitionRuleException draftNotInProgress(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "draft_not_in_progress", detail);
    }

    public static CompetitionRuleException draftAlreadyStarted(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "draft_already_started", detail);
    }

    public static CompetitionRuleException draftNotCompleted(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "draft_not_completed", detail);
    }

    public static CompetitionRuleException tournamentStarted(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "tournament_started", detail);
    }

    public static CompetitionRuleException notYourTurn(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "not_your_turn", detail);
    }

    public static CompetitionRuleException golferAlreadyDrafted(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "golfer_already_drafted", detail);
    }

    public static CompetitionRuleException insufficientParticipants(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "insufficient_participants", detail);
    }

    public static CompetitionRuleException notParticipant(String detail) {
        return new CompetitionRuleException(HttpStatus.FORBIDDEN, "not_participant", detail);
    }

    public static CompetitionRuleException alreadyParticipant(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "already_participant", detail);
    }

    public static CompetitionRuleException inviteExpired(String detail) {
        return new CompetitionRuleException(HttpStatus.GONE, "invite_expired", detail);
    }

    public static CompetitionRuleException pickConflict(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "pick_conflict", detail);
    }

    public static CompetitionRuleException adminRequired(String detail) {
        return new CompetitionRuleException(HttpStatus.FORBIDDEN, "admin_required", detail);
    }

    public static CompetitionRuleException forbidden(String detail) {
        return new CompetitionRuleException(HttpStatus.FORBIDDEN, "forbidden", detail);
    }

    public static CompetitionRuleException participantRemovalClosed(String detail) {
        return new CompetitionRuleException(HttpStatus.CONFLICT, "participant_removal_closed", detail);
    }
}
