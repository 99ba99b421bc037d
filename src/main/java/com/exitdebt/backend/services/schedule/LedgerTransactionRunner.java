package com.exitdebt.backend.services.schedule;

import java.util.function.Supplier;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.exitdebt.backend.config.LedgerProperties;
import com.exitdebt.backend.exceptions.ConcurrencyConflictException;

import lombok.extern.slf4j.Slf4j;

/**
 * Executa uma alteração do razão de uma dívida em transação própria e a repete quando perde
 * uma disputa de lock (otimista ou pessimista). Após o limite de tentativas, lança
 * {@link ConcurrencyConflictException}; demais exceções passam sem alteração.
 *
 * <p>Não deve ser chamado dentro de uma transação já aberta.
 */
@Slf4j
@Component
public class LedgerTransactionRunner {

    private final TransactionTemplate transactionTemplate;
    private final LedgerProperties properties;

    public LedgerTransactionRunner(PlatformTransactionManager transactionManager, LedgerProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        int maxAttempts = properties.maxAttempts();

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("{} falhou por concorrência após {} tentativas", operation, attempt, e);
                    throw new ConcurrencyConflictException(
                            "Conflito de concorrência ao atualizar a dívida, tente novamente", e);
                }
                log.warn("{} perdeu disputa de lock (tentativa {}/{}): {}",
                        operation, attempt, maxAttempts, e.getMessage());
                backoff(attempt, e);
            }
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    private void backoff(int attempt, ConcurrencyFailureException cause) {
        long delay = properties.backoffMillis() * attempt;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrompido aguardando nova tentativa", cause);
        }
    }
}
