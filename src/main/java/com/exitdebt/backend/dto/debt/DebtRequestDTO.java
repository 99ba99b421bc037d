package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.DebtType;

import jakarta.validation.constraints.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class DebtRequestDTO {

    @NotBlank(message = "counterpartyId é obrigatório")
    private String counterpartyId;

    @NotNull(message = "Tipo da dívida é obrigatório")
    private DebtType debtType;

    @NotNull(message = "Valor total é obrigatório")
    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    @Digits(integer = 13, fraction = 2, message = "Valor aceita no máximo 2 casas decimais")
    private BigDecimal totalAmount;

    @Size(max = 8)
    private String currency;

    private Cadence cadence;

    // Informe dueDate ou numberOfPayments
    private LocalDate dueDate;

    @Min(value = 1, message = "Número de parcelas deve ser maior ou igual a 1")
    private Integer numberOfPayments;

    private String description;
    private String notes;
}
