package com.exitdebt.backend.dto.payment;

import com.exitdebt.backend.enums.PaymentMethod;
import com.exitdebt.backend.enums.PaymentStatus;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
public class PaymentResponseDTO {

    private String id;
    private String debtId;

    private BigDecimal amount;
    private String currency;
    private LocalDate paymentDate;
    private PaymentMethod paymentMethod;
    private PaymentStatus status;
    private String description;
    private String receiptUrl;

    private String verifiedBy;
    private LocalDateTime verifiedAt;
    private String verificationNotes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
