package com.golfdraft.model;

public enum PaymentType {
    MAIN,
    BOUNTY
}
