package com.exitdebt.backend.enums;

public enum SlotStatus {
    PAID,
    PENDING
}
