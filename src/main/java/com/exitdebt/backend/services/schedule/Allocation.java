package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Resultado da alocação: parcelas preenchidas e o excedente que passou da última parcela.
 * O excedente não aparece em nenhuma parcela, mas continua contando no total pago do razão.
 */
public record Allocation(
        List<ScheduleSlot> slots,
        BigDecimal allocatedAmount,
        BigDecimal overflowAmount
) {

    public Optional<ScheduleSlot> nextPendingSlot() {
        return slots.stream()
                .filter(slot -> !slot.isPaid())
                .findFirst();
    }

    public BigDecimal scheduledTotal() {
        return slots.stream()
                .map(ScheduleSlot::getScheduledAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
