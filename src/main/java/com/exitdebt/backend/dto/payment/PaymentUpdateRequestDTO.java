package com.exitdebt.backend.dto.payment;

import com.exitdebt.backend.enums.PaymentMethod;
import com.exitdebt.backend.enums.PaymentStatus;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PaymentUpdateRequestDTO {

    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    @Digits(integer = 13, fraction = 2, message = "Valor aceita no máximo 2 casas decimais")
    private BigDecimal amount;

    @Size(min = 1, max = 8)
    private String currency;

    private LocalDate paymentDate;
    private PaymentMethod paymentMethod;
    private PaymentStatus status;
    private String description;
    private String receiptUrl;
}
