package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.dto.payment.PaymentResponseDTO;

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
public class PaymentSummaryDTO {

    private String debtId;
    private String currency;
    private BigDecimal totalAmount;
    private BigDecimal totalPaid;
    private BigDecimal remainingDebt;
    private BigDecimal percentagePaid;
    private int numberOfPayments;

    private ScheduleSlotDTO nextInstallment;
    private List<PaymentResponseDTO> payments;
}
