package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.enums.DebtType;

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
public class UpcomingPaymentDTO {

    private String debtId;
    private String counterpartyId;
    private DebtType debtType;
    private int paymentNumber;
    private LocalDate dueDate;
    private BigDecimal amountDue;
    private String currency;
    private String description;
}
