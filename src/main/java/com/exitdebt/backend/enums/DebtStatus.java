package com.exitdebt.backend.enums;

public enum DebtStatus {
    ACTIVE,
    SETTLED,
    ARCHIVED,
    OVERDUE
}
