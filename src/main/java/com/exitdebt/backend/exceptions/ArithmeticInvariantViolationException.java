package com.exitdebt.backend.exceptions;

/**
 * Saldo negativo, sobra de alocação negativa ou parcela final negativa. Nunca deve ocorrer;
 * quando ocorre a operação falha em vez de ajustar o valor silenciosamente.
 */
public class ArithmeticInvariantViolationException extends IllegalStateException {

    public ArithmeticInvariantViolationException(String message) {
        super(message);
    }
}
