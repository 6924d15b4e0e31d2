package com.golfdraft.model;

public enum DraftStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED
}
