package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.exitdebt.backend.enums.Cadence;

import lombok.Builder;
import lombok.Value;

/**
 * Entrada do normalizador. Pelo menos um entre {@code dueDate} e {@code numberOfPayments}
 * deve estar presente; quando ambos estão, o número de parcelas prevalece.
 */
@Value
@Builder
public class PlanRequest {

    BigDecimal totalAmount;
    Cadence cadence;
    LocalDate anchorDate;
    LocalDate dueDate;
    Integer numberOfPayments;
}
