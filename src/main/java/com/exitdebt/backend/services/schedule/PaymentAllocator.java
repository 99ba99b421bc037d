package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.exitdebt.backend.entities.Payment;
import com.exitdebt.backend.enums.PaymentStatus;
import com.exitdebt.backend.exceptions.ArithmeticInvariantViolationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Aplica pagamentos concluídos às parcelas, da mais antiga para a mais nova.
 *
 * <p>Um único saldo acumulado ("carry") recebe cada pagamento em ordem cronológica e quita as
 * parcelas estritamente em sequência. Um valor insuficiente fica registrado como pagamento
 * parcial na parcela atual; nenhuma parcela é marcada como paga enquanto uma anterior estiver
 * em aberto. Função pura: não altera as parcelas recebidas.
 */
@Slf4j
@Component
public class PaymentAllocator {

    static final Comparator<Payment> ALLOCATION_ORDER = Comparator
            .comparing(Payment::getPaymentDate)
            .thenComparing(Payment::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()));

    public Allocation allocate(List<ScheduleSlot> schedule, List<Payment> payments) {
        List<Payment> ordered = payments.stream()
                .filter(payment -> payment.getStatus() == PaymentStatus.COMPLETED)
                .sorted(ALLOCATION_ORDER)
                .toList();

        List<ScheduleSlot> slots = new ArrayList<>(schedule);
        BigDecimal carry = BigDecimal.ZERO;
        BigDecimal allocated = BigDecimal.ZERO;
        int current = 0;

        for (Payment payment : ordered) {
            carry = carry.add(payment.getAmount());

            while (current < slots.size()) {
                ScheduleSlot slot = slots.get(current);
                BigDecimal needed = slot.getRemainingAmount();

                if (needed.signum() == 0) {
                    slots.set(current, slot.withPaidAmount(slot.getPaidAmount()));
                    current++;
                    continue;
                }
                if (carry.signum() == 0) {
                    break;
                }

                if (carry.compareTo(needed) >= 0) {
                    slots.set(current, slot.withPaidAmount(slot.getScheduledAmount()));
                    carry = carry.subtract(needed);
                    allocated = allocated.add(needed);
                    current++;
                } else {
                    slots.set(current, slot.withPaidAmount(slot.getPaidAmount().add(carry)));
                    allocated = allocated.add(carry);
                    carry = BigDecimal.ZERO;
                }
            }

            if (carry.signum() < 0) {
                throw new ArithmeticInvariantViolationException("Saldo de alocação negativo: " + carry);
            }
        }

        if (carry.signum() > 0) {
            log.debug("Pagamentos excedem o cronograma em {}", carry);
        }

        return new Allocation(List.copyOf(slots), allocated, carry);
    }
}
