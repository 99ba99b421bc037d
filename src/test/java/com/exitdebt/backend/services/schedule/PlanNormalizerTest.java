package com.exitdebt.backend.services.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.exitdebt.backend.config.ScheduleProperties;
import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.PlanBasis;
import com.exitdebt.backend.exceptions.BadRequestException;

class PlanNormalizerTest {

    private static final LocalDate ANCHOR = LocalDate.of(2024, 1, 15);

    private final PlanNormalizer normalizer = new PlanNormalizer(ScheduleProperties.defaults());

    @Test
    @DisplayName("Vencimento em criação + 4 meses resolve 4 parcelas de 250.00")
    void normalize_dueDate_resolvesNumberOfPayments() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("1000.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .dueDate(ANCHOR.plusMonths(4))
                .build());

        assertEquals(4, plan.getNumberOfPayments());
        assertEquals(new BigDecimal("250.00"), plan.getInstallmentAmount());
        assertEquals(LocalDate.of(2024, 5, 15), plan.getDueDate());
        assertEquals(PlanBasis.DUE_DATE, plan.getBasis());
    }

    @Test
    void normalize_numberOfPayments_derivesDueDateOfLastInstallment() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("1000"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .numberOfPayments(4)
                .build());

        assertEquals(4, plan.getNumberOfPayments());
        assertEquals(new BigDecimal("250.00"), plan.getInstallmentAmount());
        assertEquals(new BigDecimal("1000.00"), plan.getTotalAmount());
        assertEquals(LocalDate.of(2024, 5, 15), plan.getDueDate());
        assertEquals(PlanBasis.PAYMENT_COUNT, plan.getBasis());
    }

    @Test
    void normalize_bothGiven_paymentCountWins() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("1200.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .dueDate(ANCHOR.plusMonths(12))
                .numberOfPayments(6)
                .build());

        assertEquals(6, plan.getNumberOfPayments());
        assertEquals(LocalDate.of(2024, 7, 15), plan.getDueDate());
        assertEquals(PlanBasis.PAYMENT_COUNT, plan.getBasis());
    }

    @Test
    @DisplayName("N -> vencimento -> N para todas as cadências")
    void normalize_countToDueDateToCount_roundTrips() {
        for (Cadence cadence : Cadence.values()) {
            for (int n = 1; n <= 24; n++) {
                NormalizedPlan byCount = normalizer.normalize(PlanRequest.builder()
                        .totalAmount(new BigDecimal("5000.00"))
                        .cadence(cadence)
                        .anchorDate(LocalDate.of(2024, 1, 31))
                        .numberOfPayments(n)
                        .build());

                NormalizedPlan byDueDate = normalizer.normalize(PlanRequest.builder()
                        .totalAmount(new BigDecimal("5000.00"))
                        .cadence(cadence)
                        .anchorDate(LocalDate.of(2024, 1, 31))
                        .dueDate(byCount.getDueDate())
                        .build());

                assertEquals(byCount.getNumberOfPayments(), byDueDate.getNumberOfPayments(), cadence + " N=" + n);
                assertEquals(byCount.getInstallmentAmount(), byDueDate.getInstallmentAmount(), cadence + " N=" + n);
            }
        }
    }

    @Test
    void normalize_oneTime_forcesSingleInstallmentDueOneMonthLater() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("300.00"))
                .cadence(Cadence.ONE_TIME)
                .anchorDate(ANCHOR)
                .numberOfPayments(5)
                .build());

        assertEquals(1, plan.getNumberOfPayments());
        assertEquals(new BigDecimal("300.00"), plan.getInstallmentAmount());
        assertEquals(LocalDate.of(2024, 2, 15), plan.getDueDate());
    }

    @Test
    void normalize_missingCadence_defaultsToMonthly() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .anchorDate(ANCHOR)
                .numberOfPayments(2)
                .build());

        assertEquals(Cadence.MONTHLY, plan.getCadence());
    }

    @Test
    void normalize_dueDateInsideFirstPeriod_resolvesToOneInstallment() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .dueDate(ANCHOR.plusDays(10))
                .build());

        assertEquals(1, plan.getNumberOfPayments());
        assertEquals(ANCHOR.plusDays(10), plan.getDueDate());
    }

    @Test
    void normalize_roundsInstallmentHalfUp() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.WEEKLY)
                .anchorDate(ANCHOR)
                .numberOfPayments(3)
                .build());

        assertEquals(new BigDecimal("33.33"), plan.getInstallmentAmount());
    }

    @Test
    void normalize_withoutDueDateOrCount_throws() {
        PlanRequest request = PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .build();

        assertThrows(BadRequestException.class, () -> normalizer.normalize(request));
    }

    @Test
    void normalize_dueDateNotAfterAnchor_throws() {
        PlanRequest request = PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .dueDate(ANCHOR)
                .build();

        assertThrows(BadRequestException.class, () -> normalizer.normalize(request));
    }

    @Test
    void normalize_invalidAmounts_throw() {
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("0.00", 2)));
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("-10.00", 2)));
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("10.005", 2)));
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("100.00", 0)));
    }

    @Test
    void normalize_aboveInstallmentLimit_throws() {
        PlanNormalizer limited = new PlanNormalizer(new ScheduleProperties(12, null, null, null));

        assertThrows(BadRequestException.class, () -> limited.normalize(countRequest("100.00", 13)));
        assertThrows(BadRequestException.class, () -> limited.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.WEEKLY)
                .anchorDate(ANCHOR)
                .dueDate(ANCHOR.plusYears(1))
                .build()));
        assertEquals(12, limited.normalize(countRequest("100.00", 12)).getNumberOfPayments());
    }

    @Test
    @DisplayName("Rejeita plano em que a última parcela ficaria negativa")
    void normalize_totalTooSmallForInstallments_throws() {
        // 0.05 / 10 = 0.01 (HALF_UP); 9 x 0.01 = 0.09 > 0.05
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("0.05", 10)));
    }

    @Test
    @DisplayName("Rejeita plano em que a última parcela ficaria zerada")
    void normalize_finalInstallmentWouldBeZero_throws() {
        // 0.03 / 4 = 0.01 (HALF_UP); 3 x 0.01 = 0.03, sobra 0.00 para a parcela 4
        assertThrows(BadRequestException.class, () -> normalizer.normalize(countRequest("0.03", 4)));
        assertEquals(3, normalizer.normalize(countRequest("0.03", 3)).getNumberOfPayments());
    }

    @Test
    void normalize_missingAnchor_throwsIllegalArgument() {
        PlanRequest request = PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .numberOfPayments(2)
                .build();

        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(request));
    }

    @Test
    void nextPaymentDate_usesLastPaymentOrAnchor() {
        NormalizedPlan plan = normalizer.normalize(countRequest("1000.00", 4));

        assertEquals(LocalDate.of(2024, 2, 15), normalizer.nextPaymentDate(plan, null));
        assertEquals(LocalDate.of(2024, 3, 20), normalizer.nextPaymentDate(plan, LocalDate.of(2024, 2, 20)));
    }

    @Test
    void nextPaymentDate_oneTime_isDueDate() {
        NormalizedPlan plan = normalizer.normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("100.00"))
                .cadence(Cadence.ONE_TIME)
                .anchorDate(ANCHOR)
                .dueDate(LocalDate.of(2024, 6, 1))
                .build());

        assertEquals(LocalDate.of(2024, 6, 1), normalizer.nextPaymentDate(plan, LocalDate.of(2024, 3, 1)));
    }

    private PlanRequest countRequest(String total, int count) {
        return PlanRequest.builder()
                .totalAmount(new BigDecimal(total))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .numberOfPayments(count)
                .build();
    }
}
