package com.golfdraft.service;

import com.golfdraft.model.PaymentType;

import java.math.BigDecimal;
import java.util.UUID;

public record PaymentTransfer(
        UUID fromUserId,
        UUID toUserId,
        BigDecimal amount,
        PaymentType paymentType
) {
}
