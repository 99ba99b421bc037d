package com.exitdebt.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exitdebt.ledger")
public record LedgerProperties(
        Integer maxAttempts,
        Long backoffMillis
) {
    public LedgerProperties {
        if (maxAttempts == null || maxAttempts < 1) {
            maxAttempts = 3;
        }
        if (backoffMillis == null || backoffMillis < 0) {
            backoffMillis = 50L;
        }
    }
}
