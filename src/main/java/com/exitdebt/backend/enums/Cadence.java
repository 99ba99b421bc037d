package com.exitdebt.backend.enums;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Intervalo entre parcelas de uma dívida.
 *
 * <p>Períodos mensais, trimestrais e anuais usam aritmética de calendário: o dia do mês é
 * preservado e, quando não existe no mês de destino, é ajustado para o último dia
 * (31/01 + 1 mês = 28/02 ou 29/02).
 */
public enum Cadence {

    ONE_TIME(ChronoUnit.MONTHS, 1),
    WEEKLY(ChronoUnit.DAYS, 7),
    BIWEEKLY(ChronoUnit.DAYS, 14),
    MONTHLY(ChronoUnit.MONTHS, 1),
    QUARTERLY(ChronoUnit.MONTHS, 3),
    YEARLY(ChronoUnit.YEARS, 1);

    private final ChronoUnit unit;
    private final int unitsPerPeriod;

    Cadence(ChronoUnit unit, int unitsPerPeriod) {
        this.unit = unit;
        this.unitsPerPeriod = unitsPerPeriod;
    }

    public boolean isRecurring() {
        return this != ONE_TIME;
    }

    /**
     * Avança {@code periods} períodos a partir de {@code anchor}, sempre calculando a partir da
     * âncora (nunca encadeando), para que o ajuste de fim de mês não acumule deslocamento.
     */
    public LocalDate advance(LocalDate anchor, long periods) {
        if (periods < 0) {
            throw new IllegalArgumentException("periods não pode ser negativo");
        }
        return anchor.plus(periods * unitsPerPeriod, unit);
    }

    /**
     * Quantidade de períodos completos entre {@code from} e {@code to}: o maior k tal que
     * {@code advance(from, k) <= to}. Retorna 0 quando {@code to} não está após {@code from}.
     */
    public long wholePeriodsBetween(LocalDate from, LocalDate to) {
        if (!to.isAfter(from)) {
            return 0;
        }

        long estimate = Math.max(0, unit.between(from, to) / unitsPerPeriod);

        // unit.between ignora o ajuste de fim de mês (31/01 -> 28/02 conta 0 meses)
        while (!advance(from, estimate + 1).isAfter(to)) {
            estimate++;
        }
        while (estimate > 0 && advance(from, estimate).isAfter(to)) {
            estimate--;
        }
        return estimate;
    }
}
