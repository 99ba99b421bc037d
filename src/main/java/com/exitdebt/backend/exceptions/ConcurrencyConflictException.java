package com.exitdebt.backend.exceptions;

/**
 * A atualização do razão da dívida perdeu a disputa de concorrência em todas as tentativas.
 * É transitória: o cliente pode repetir a requisição.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
