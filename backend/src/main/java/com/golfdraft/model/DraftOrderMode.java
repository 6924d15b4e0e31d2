package com.golfdraft.model;

public enum DraftOrderMode {
    RANDOM,
    PRIOR_STANDINGS
}
