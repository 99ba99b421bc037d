package com.exitdebt.backend.enums;

public enum DebtType {
    OWED_TO_ME,
    I_OWE
}
