package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.exitdebt.backend.exceptions.ArithmeticInvariantViolationException;

/**
 * Expande um plano normalizado nas parcelas 1..N, sem olhar pagamentos.
 *
 * <p>A parcela k vence em âncora + k períodos (a primeira vence um período após a criação).
 * As parcelas 1..N-1 valem o valor da parcela; a parcela N recebe o total menos a soma das
 * anteriores, de modo que a soma do cronograma é exatamente o valor total.
 */
@Component
public class ScheduleBuilder {

    public List<ScheduleSlot> build(NormalizedPlan plan) {
        int count = plan.getNumberOfPayments();
        if (count < 1) {
            throw new ArithmeticInvariantViolationException("Plano sem parcelas: " + count);
        }

        List<ScheduleSlot> slots = new ArrayList<>(count);
        BigDecimal scheduledSoFar = BigDecimal.ZERO;

        for (int number = 1; number <= count; number++) {
            BigDecimal amount = number < count
                    ? plan.getInstallmentAmount()
                    : plan.getTotalAmount().subtract(scheduledSoFar);

            if (amount.signum() < 0) {
                throw new ArithmeticInvariantViolationException(
                        "Parcela " + number + " ficaria negativa: " + amount);
            }

            ScheduleSlot slot = ScheduleSlot.pending(number, dueDateOf(plan, number), amount);
            // Parcela zerada (planos gravados antes da validação atual) já nasce quitada
            slots.add(amount.signum() == 0 ? slot.withPaidAmount(Money.ZERO) : slot);
            scheduledSoFar = scheduledSoFar.add(amount);
        }

        return List.copyOf(slots);
    }

    private LocalDate dueDateOf(NormalizedPlan plan, int number) {
        if (!plan.getCadence().isRecurring()) {
            return plan.getDueDate();
        }
        return plan.getCadence().advance(plan.getAnchorDate(), number);
    }
}
