package com.exitdebt.backend.dto.debt;

import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.DebtStatus;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Atualização parcial: campos nulos são mantidos.
 */
@Data
public class DebtUpdateRequestDTO {

    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    @Digits(integer = 13, fraction = 2, message = "Valor aceita no máximo 2 casas decimais")
    private BigDecimal totalAmount;

    @Size(min = 1, max = 8)
    private String currency;

    private Cadence cadence;
    private LocalDate dueDate;

    @Min(value = 1, message = "Número de parcelas deve ser maior ou igual a 1")
    private Integer numberOfPayments;

    // Apenas ARCHIVED ou ACTIVE (desarquivar); os demais são calculados
    private DebtStatus status;

    private String description;
    private String notes;
}
