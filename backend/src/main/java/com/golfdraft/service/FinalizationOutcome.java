package com.golfdraft.service;

public enum FinalizationOutcome {
    FINALIZED,
    ALREADY_FINALIZED,
    NOT_READY
}
