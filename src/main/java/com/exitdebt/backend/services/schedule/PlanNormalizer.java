package com.exitdebt.backend.services.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.exitdebt.backend.config.ScheduleProperties;
import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.PlanBasis;
import com.exitdebt.backend.exceptions.BadRequestException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolve cadência, valor total e data de vencimento ou número de parcelas em um
 * {@link NormalizedPlan}.
 *
 * <p>Com o número de parcelas N informado, o vencimento é a data da parcela N
 * (âncora + N períodos). Com o vencimento informado, N é a quantidade de períodos completos
 * de calendário entre a âncora e o vencimento, no mínimo 1. Os dois caminhos são inversos um
 * do outro para todas as cadências.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanNormalizer {

    private static final Cadence DEFAULT_CADENCE = Cadence.MONTHLY;

    private final ScheduleProperties properties;

    public NormalizedPlan normalize(PlanRequest request) {
        if (request.getAnchorDate() == null) {
            throw new IllegalArgumentException("anchorDate é obrigatório");
        }

        BigDecimal total = Money.requirePositive(request.getTotalAmount(), "Valor total");
        Cadence cadence = request.getCadence() != null ? request.getCadence() : DEFAULT_CADENCE;
        LocalDate anchor = request.getAnchorDate();
        Integer requestedCount = request.getNumberOfPayments();
        LocalDate requestedDueDate = request.getDueDate();

        if (requestedCount == null && requestedDueDate == null) {
            throw new BadRequestException("Informe a data de vencimento ou o número de parcelas");
        }

        int count;
        LocalDate dueDate;
        PlanBasis basis;

        if (requestedCount != null) {
            if (requestedCount < 1) {
                throw new BadRequestException("Número de parcelas deve ser maior ou igual a 1");
            }
            requireWithinBound(requestedCount);

            basis = PlanBasis.PAYMENT_COUNT;
            count = cadence.isRecurring() ? requestedCount : 1;
            dueDate = cadence.advance(anchor, count);
        } else {
            if (!requestedDueDate.isAfter(anchor)) {
                throw new BadRequestException("Data de vencimento deve ser posterior à data de criação");
            }

            long periods = cadence.isRecurring() ? cadence.wholePeriodsBetween(anchor, requestedDueDate) : 1;
            requireWithinBound(periods);

            basis = PlanBasis.DUE_DATE;
            count = (int) Math.max(1, periods);
            dueDate = requestedDueDate;
        }

        BigDecimal installment = Money.divide(total, count);

        // A última parcela absorve o arredondamento e precisa ficar positiva
        BigDecimal firstInstallments = installment.multiply(BigDecimal.valueOf(count - 1L));
        if (firstInstallments.compareTo(total) >= 0) {
            throw new BadRequestException(
                    "Valor total " + total + " não pode ser dividido em " + count + " parcelas");
        }

        log.debug("Plano normalizado: cadence={}, total={}, parcelas={}, valorParcela={}, vencimento={}, base={}",
                cadence, total, count, installment, dueDate, basis);

        return NormalizedPlan.builder()
                .cadence(cadence)
                .anchorDate(anchor)
                .totalAmount(total)
                .numberOfPayments(count)
                .installmentAmount(installment)
                .dueDate(dueDate)
                .basis(basis)
                .build();
    }

    /**
     * Próximo vencimento: último pagamento concluído + 1 período, ou âncora + 1 período quando
     * ainda não há pagamentos. Dívidas de pagamento único vencem sempre na data do plano.
     */
    public LocalDate nextPaymentDate(NormalizedPlan plan, LocalDate lastPaymentDate) {
        if (!plan.getCadence().isRecurring()) {
            return plan.getDueDate();
        }
        LocalDate reference = lastPaymentDate != null ? lastPaymentDate : plan.getAnchorDate();
        return plan.getCadence().advance(reference, 1);
    }

    private void requireWithinBound(long count) {
        if (count > properties.maxInstallments()) {
            throw new BadRequestException(
                    "Plano excede o limite de " + properties.maxInstallments() + " parcelas");
        }
    }
}
