package com.exitdebt.backend.dto.payment;

import com.exitdebt.backend.enums.PaymentMethod;

import jakarta.validation.constraints.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PaymentRequestDTO {

    @NotBlank(message = "debtId é obrigatório")
    private String debtId;

    @NotNull(message = "Valor é obrigatório")
    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    @Digits(integer = 13, fraction = 2, message = "Valor aceita no máximo 2 casas decimais")
    private BigDecimal amount;

    @Size(max = 8)
    private String currency;

    @NotNull(message = "Data do pagamento é obrigatória")
    private LocalDate paymentDate;

    @NotNull(message = "Forma de pagamento é obrigatória")
    private PaymentMethod paymentMethod;

    private String description;
    private String receiptUrl;
}
