package com.golfdraft.model;

public enum TournamentStatus {
    UPCOMING,
    ACTIVE,
    COMPLETED
}
