package com.exitdebt.backend.dto.payment;

import com.exitdebt.backend.enums.PaymentStatus;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PaymentVerificationRequestDTO {

    // COMPLETED ou REJECTED
    @NotNull(message = "Status é obrigatório")
    private PaymentStatus status;

    private String verificationNotes;
}
