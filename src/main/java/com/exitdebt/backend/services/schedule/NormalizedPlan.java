package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.PlanBasis;

import lombok.Builder;
import lombok.Value;

/**
 * Plano canônico de uma dívida: quantas parcelas, de quanto e até quando.
 */
@Value
@Builder
public class NormalizedPlan {

    Cadence cadence;
    LocalDate anchorDate;
    BigDecimal totalAmount;
    int numberOfPayments;
    BigDecimal installmentAmount;
    LocalDate dueDate;
    PlanBasis basis;

    /**
     * Reconstrói o plano a partir dos campos persistidos da dívida, sem renormalizar.
     */
    public static NormalizedPlan fromDebt(Debt debt) {
        return NormalizedPlan.builder()
                .cadence(debt.getCadence())
                .anchorDate(debt.getCreatedAt().toLocalDate())
                .totalAmount(debt.getTotalAmount())
                .numberOfPayments(debt.getNumberOfPayments())
                .installmentAmount(debt.getInstallmentAmount())
                .dueDate(debt.getDueDate())
                .basis(debt.getPlanBasis())
                .build();
    }

    public void applyTo(Debt debt) {
        debt.setCadence(cadence);
        debt.setTotalAmount(totalAmount);
        debt.setNumberOfPayments(numberOfPayments);
        debt.setInstallmentAmount(installmentAmount);
        debt.setDueDate(dueDate);
        debt.setPlanBasis(basis);
    }
}
