package com.exitdebt.backend.enums;

public enum AuditEventStatus {
    SUCCESS,
    FAILURE
}
