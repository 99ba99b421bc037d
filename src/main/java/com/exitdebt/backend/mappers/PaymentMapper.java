package com.exitdebt.backend.mappers;

import com.exitdebt.backend.dto.payment.PaymentResponseDTO;
import com.exitdebt.backend.entities.Payment;

public class PaymentMapper {

    private PaymentMapper() {}

    public static PaymentResponseDTO toResponseDTO(Payment payment) {
        PaymentResponseDTO dto = new PaymentResponseDTO();

        dto.setId(payment.getId().toString());
        dto.setDebtId(payment.getDebt().getId().toString());
        dto.setAmount(payment.getAmount());
        dto.setCurrency(payment.getCurrency());
        dto.setPaymentDate(payment.getPaymentDate());
        dto.setPaymentMethod(payment.getPaymentMethod());
        dto.setStatus(payment.getStatus());
        dto.setDescription(payment.getDescription());
        dto.setReceiptUrl(payment.getReceiptUrl());
        dto.setVerifiedBy(payment.getVerifiedBy() != null ? payment.getVerifiedBy().toString() : null);
        dto.setVerifiedAt(payment.getVerifiedAt());
        dto.setVerificationNotes(payment.getVerificationNotes());
        dto.setCreatedAt(payment.getCreatedAt());
        dto.setUpdatedAt(payment.getUpdatedAt());

        return dto;
    }
}
