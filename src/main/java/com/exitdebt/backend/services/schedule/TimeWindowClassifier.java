package com.exitdebt.backend.services.schedule;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.entities.Payment;
import com.exitdebt.backend.exceptions.BadRequestException;
import com.exitdebt.backend.repositories.DebtRepository;
import com.exitdebt.backend.repositories.PaymentRepository;

import lombok.RequiredArgsConstructor;

/**
 * Consultas por janela de tempo. Dívidas arquivadas ficam de fora das três consultas.
 */
@Service
@RequiredArgsConstructor
public class TimeWindowClassifier {

    static final int MAX_WINDOW_DAYS = 365;

    private final DebtRepository debtRepository;
    private final PaymentRepository paymentRepository;
    private final ScheduleBuilder scheduleBuilder;
    private final PaymentAllocator paymentAllocator;
    private final Clock clock;

    /** Saldo em aberto e vencimento anterior a hoje. */
    @Transactional(readOnly = true)
    public List<Debt> overdue(UUID ownerId) {
        return debtRepository.findOverdue(ownerId, today());
    }

    /** Saldo em aberto e vencimento entre hoje e hoje + {@code days}, inclusive. */
    @Transactional(readOnly = true)
    public List<Debt> dueSoon(UUID ownerId, int days) {
        // 0 = vence hoje
        requireWindow(days, 0);
        LocalDate today = today();
        return debtRepository.findDueBetween(ownerId, today, today.plusDays(days));
    }

    /**
     * Parcelas pendentes com vencimento em (hoje, hoje + {@code days}], calculadas por dívida a
     * partir do cronograma e dos pagamentos concluídos.
     */
    @Transactional(readOnly = true)
    public List<UpcomingInstallment> upcoming(UUID ownerId, int days) {
        requireWindow(days, 1);
        LocalDate today = today();
        LocalDate until = today.plusDays(days);

        List<Debt> debts = debtRepository.findOpenByOwner(ownerId);
        if (debts.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<Payment>> paymentsByDebt = paymentRepository
                .findCompletedForAllocation(debts.stream().map(Debt::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(payment -> payment.getDebt().getId()));

        List<UpcomingInstallment> upcoming = new ArrayList<>();
        for (Debt debt : debts) {
            List<ScheduleSlot> schedule = scheduleBuilder.build(NormalizedPlan.fromDebt(debt));
            Allocation allocation = paymentAllocator.allocate(
                    schedule, paymentsByDebt.getOrDefault(debt.getId(), List.of()));

            for (ScheduleSlot slot : allocation.slots()) {
                if (isWithinWindow(slot, today, until)) {
                    upcoming.add(new UpcomingInstallment(debt, slot));
                }
            }
        }

        upcoming.sort(Comparator
                .comparing((UpcomingInstallment item) -> item.slot().getDueDate())
                .thenComparing(item -> item.slot().getPaymentNumber()));
        return upcoming;
    }

    static boolean isWithinWindow(ScheduleSlot slot, LocalDate today, LocalDate until) {
        return !slot.isPaid()
                && slot.getDueDate().isAfter(today)
                && !slot.getDueDate().isAfter(until);
    }

    private void requireWindow(int days, int minDays) {
        if (days < minDays || days > MAX_WINDOW_DAYS) {
            throw new BadRequestException("days deve estar entre " + minDays + " e " + MAX_WINDOW_DAYS);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
