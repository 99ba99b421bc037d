package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.enums.SlotStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSlotDTO {

    private int paymentNumber;
    private LocalDate dueDate;
    private BigDecimal scheduledAmount;
    private BigDecimal paidAmount;
    private BigDecimal remainingAmount;
    private SlotStatus status;
}
