package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.DebtStatus;
import com.exitdebt.backend.enums.DebtType;
import com.exitdebt.backend.enums.PlanBasis;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
public class DebtResponseDTO {

    private String id;
    private String ownerId;
    private String counterpartyId;
    private DebtType debtType;

    private BigDecimal totalAmount;
    private BigDecimal installmentAmount;
    private String currency;
    private Cadence cadence;
    private PlanBasis planBasis;
    private Integer numberOfPayments;
    private LocalDate dueDate;

    private BigDecimal paidTotal;
    private BigDecimal remainingTotal;
    private DebtStatus status;
    private LocalDate nextPaymentDate;

    private String description;
    private String notes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
