package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.enums.DebtStatus;
import com.exitdebt.backend.exceptions.ArithmeticInvariantViolationException;
import com.exitdebt.backend.repositories.DebtRepository;
import com.exitdebt.backend.repositories.PaymentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recalcula os campos em cache da dívida: total pago, saldo, status e próximo vencimento.
 *
 * <p>Deve rodar dentro da transação que já detém o lock da dívida
 * ({@link DebtRepository#findByIdAndOwnerIdForUpdate}), junto com a escrita do pagamento.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerReconciler {

    private final DebtRepository debtRepository;
    private final PaymentRepository paymentRepository;
    private final PlanNormalizer planNormalizer;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public Debt reconcile(Debt lockedDebt) {
        BigDecimal paidTotal = paymentRepository.sumCompletedAmount(lockedDebt.getId());
        LocalDate lastPaymentDate = paymentRepository.findLastCompletedPaymentDate(lockedDebt.getId())
                .orElse(null);

        apply(lockedDebt, paidTotal, lastPaymentDate, LocalDate.now(clock));
        return debtRepository.save(lockedDebt);
    }

    void apply(Debt debt, BigDecimal paidTotal, LocalDate lastPaymentDate, LocalDate today) {
        BigDecimal paid = Money.normalize(paidTotal);
        if (paid.signum() < 0) {
            throw new ArithmeticInvariantViolationException(
                    "Total pago negativo para a dívida " + debt.getId() + ": " + paid);
        }

        BigDecimal total = debt.getTotalAmount();
        BigDecimal remaining = total.subtract(paid);
        if (remaining.signum() < 0) {
            log.info("Dívida {} recebeu {} além do valor total {}", debt.getId(), remaining.negate(), total);
            remaining = Money.ZERO;
        }

        debt.setPaidTotal(paid);
        debt.setRemainingTotal(remaining);
        debt.setStatus(deriveStatus(debt, remaining, today));
        debt.setNextPaymentDate(planNormalizer.nextPaymentDate(NormalizedPlan.fromDebt(debt), lastPaymentDate));

        log.info("Razão da dívida {} atualizado: pago={}, saldo={}, status={}, próximo={}",
                debt.getId(), paid, remaining, debt.getStatus(), debt.getNextPaymentDate());
    }

    private DebtStatus deriveStatus(Debt debt, BigDecimal remaining, LocalDate today) {
        // Arquivada é estado manual e terminal
        if (debt.getStatus() == DebtStatus.ARCHIVED) {
            return DebtStatus.ARCHIVED;
        }
        if (remaining.signum() == 0) {
            return DebtStatus.SETTLED;
        }
        if (today.isAfter(debt.getDueDate())) {
            return DebtStatus.OVERDUE;
        }
        return DebtStatus.ACTIVE;
    }
}
