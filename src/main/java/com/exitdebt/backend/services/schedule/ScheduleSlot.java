package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.exitdebt.backend.enums.SlotStatus;

import lombok.Builder;
import lombok.Value;

/**
 * Uma parcela do cronograma. Derivada a cada leitura, nunca persistida.
 */
@Value
@Builder(toBuilder = true)
public class ScheduleSlot {

    int paymentNumber;
    LocalDate dueDate;
    BigDecimal scheduledAmount;
    BigDecimal paidAmount;
    SlotStatus status;

    public static ScheduleSlot pending(int paymentNumber, LocalDate dueDate, BigDecimal scheduledAmount) {
        return ScheduleSlot.builder()
                .paymentNumber(paymentNumber)
                .dueDate(dueDate)
                .scheduledAmount(scheduledAmount)
                .paidAmount(Money.ZERO)
                .status(SlotStatus.PENDING)
                .build();
    }

    public BigDecimal getRemainingAmount() {
        return scheduledAmount.subtract(paidAmount);
    }

    public boolean isPaid() {
        return status == SlotStatus.PAID;
    }

    ScheduleSlot withPaidAmount(BigDecimal paid) {
        SlotStatus newStatus = paid.compareTo(scheduledAmount) >= 0 ? SlotStatus.PAID : SlotStatus.PENDING;
        return toBuilder()
                .paidAmount(paid)
                .status(newStatus)
                .build();
    }
}
