package com.exitdebt.backend.services.schedule;

import com.exitdebt.backend.entities.Debt;

public record UpcomingInstallment(Debt debt, ScheduleSlot slot) {
}
