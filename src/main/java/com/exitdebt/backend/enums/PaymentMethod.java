package com.exitdebt.backend.enums;

public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHECK,
    DIGITAL_WALLET,
    OTHER
}
