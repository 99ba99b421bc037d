package com.exitdebt.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exitdebt.schedule")
public record ScheduleProperties(
        Integer maxInstallments,
        String defaultCurrency,
        Integer dueSoonDays,
        Integer upcomingDays
) {
    public ScheduleProperties {
        if (maxInstallments == null || maxInstallments < 1) {
            maxInstallments = 1000;
        }
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "PHP";
        }
        if (dueSoonDays == null || dueSoonDays < 1) {
            dueSoonDays = 7;
        }
        if (upcomingDays == null || upcomingDays < 1) {
            upcomingDays = 30;
        }
    }

    public static ScheduleProperties defaults() {
        return new ScheduleProperties(null, null, null, null);
    }
}
