package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.exitdebt.backend.exceptions.BadRequestException;

/**
 * Regras de valores monetários: sempre {@link BigDecimal}, escala da menor unidade da moeda (2).
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    /**
     * Valida um valor informado pelo usuário (positivo, no máximo 2 casas) e o coloca na escala padrão.
     */
    public static BigDecimal requirePositive(BigDecimal value, String fieldLabel) {
        if (value == null) throw new BadRequestException(fieldLabel + " é obrigatório");
        if (value.signum() <= 0) throw new BadRequestException(fieldLabel + " deve ser maior que zero");
        if (value.stripTrailingZeros().scale() > SCALE) {
            throw new BadRequestException(fieldLabel + " aceita no máximo " + SCALE + " casas decimais");
        }
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Divisão usada apenas no valor da parcela: arredonda HALF_UP na escala da moeda.
     */
    public static BigDecimal divide(BigDecimal total, int parts) {
        return total.divide(BigDecimal.valueOf(parts), SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) return ZERO;
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
