package com.exitdebt.backend.dto.debt;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentScheduleDTO {

    private String debtId;
    private String currency;
    private BigDecimal totalAmount;
    private BigDecimal installmentAmount;
    private int numberOfPayments;

    private List<ScheduleSlotDTO> slots;

    // Valor pago além da última parcela; não aparece em nenhuma parcela
    private BigDecimal overflowAmount;
}
