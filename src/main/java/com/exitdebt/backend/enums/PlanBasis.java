package com.exitdebt.backend.enums;

/**
 * Qual entrada do plano é a autoritativa; a outra é derivada pelo normalizador.
 */
public enum PlanBasis {
    DUE_DATE,
    PAYMENT_COUNT
}
