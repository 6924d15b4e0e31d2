package com.golfdraft.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CompetitionRuleExceptionHandler {

    @ExceptionHandler(CompetitionRuleException.class)
    public ResponseEntity<CompetitionRuleErrorResponse> handle(CompetitionRuleException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new CompetitionRuleErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record CompetitionRuleErrorResponse(
            String code,
            String message
    ) {
    }
}
