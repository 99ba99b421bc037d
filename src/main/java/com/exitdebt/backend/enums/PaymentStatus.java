package com.exitdebt.backend.enums;

public enum PaymentStatus {
    COMPLETED,
    PENDING,
    FAILED,
    REFUNDED,
    REJECTED
}
