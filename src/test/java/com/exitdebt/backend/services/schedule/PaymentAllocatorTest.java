package com.exitdebt.backend.services.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.exitdebt.backend.config.ScheduleProperties;
import com.exitdebt.backend.entities.Payment;
import com.exitdebt.backend.enums.Cadence;
import com.exitdebt.backend.enums.PaymentMethod;
import com.exitdebt.backend.enums.PaymentStatus;
import com.exitdebt.backend.enums.SlotStatus;

class PaymentAllocatorTest {

    private static final LocalDate ANCHOR = LocalDate.of(2024, 1, 15);

    private final PaymentAllocator allocator = new PaymentAllocator();
    private List<ScheduleSlot> schedule;

    @BeforeEach
    void setUp() {
        NormalizedPlan plan = new PlanNormalizer(ScheduleProperties.defaults()).normalize(PlanRequest.builder()
                .totalAmount(new BigDecimal("1000.00"))
                .cadence(Cadence.MONTHLY)
                .anchorDate(ANCHOR)
                .numberOfPayments(4)
                .build());
        schedule = new ScheduleBuilder().build(plan);
    }

    @Test
    void allocate_exactInstallment_paysFirstSlotOnly() {
        Allocation allocation = allocator.allocate(schedule, List.of(completed("250.00", 1)));

        List<ScheduleSlot> slots = allocation.slots();
        assertEquals(SlotStatus.PAID, slots.get(0).getStatus());
        assertEquals(SlotStatus.PENDING, slots.get(1).getStatus());
        assertEquals(SlotStatus.PENDING, slots.get(2).getStatus());
        assertEquals(SlotStatus.PENDING, slots.get(3).getStatus());
        assertEquals(new BigDecimal("250.00"), allocation.allocatedAmount());
        assertEquals(0, allocation.overflowAmount().signum());
    }

    @Test
    @DisplayName("Pagamento parcial fica na parcela corrente")
    void allocate_partialAmount_staysOnCurrentSlot() {
        Allocation allocation = allocator.allocate(schedule, List.of(completed("400.00", 1)));

        ScheduleSlot first = allocation.slots().get(0);
        ScheduleSlot second = allocation.slots().get(1);
        assertEquals(SlotStatus.PAID, first.getStatus());
        assertEquals(new BigDecimal("150.00"), second.getPaidAmount());
        assertEquals(new BigDecimal("100.00"), second.getRemainingAmount());
        assertEquals(SlotStatus.PENDING, second.getStatus());
        assertEquals(new BigDecimal("0.00"), allocation.slots().get(2).getPaidAmount());
        assertEquals(allocation.slots().get(1), allocation.nextPendingSlot().orElseThrow());
    }

    @Test
    void allocate_severalSmallPayments_fillInOrder() {
        Allocation allocation = allocator.allocate(schedule, List.of(
                completed("100.00", 1),
                completed("100.00", 2),
                completed("100.00", 3)
        ));

        assertEquals(new BigDecimal("250.00"), allocation.slots().get(0).getPaidAmount());
        assertEquals(new BigDecimal("50.00"), allocation.slots().get(1).getPaidAmount());
        assertEquals(new BigDecimal("300.00"), allocation.allocatedAmount());
    }

    @Test
    @DisplayName("Nenhuma parcela recebe valor enquanto a anterior não estiver quitada")
    void allocate_fillIsMonotonic() {
        Allocation allocation = allocator.allocate(schedule, List.of(
                completed("333.33", 1),
                completed("10.00", 5),
                completed("77.77", 9)
        ));

        List<ScheduleSlot> slots = allocation.slots();
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i).getPaidAmount().signum() > 0) {
                assertTrue(slots.get(i - 1).isPaid(), "parcela " + i + " recebeu antes da anterior");
            }
        }
    }

    @Test
    void allocate_overpayment_reportsOverflowSeparately() {
        Allocation allocation = allocator.allocate(schedule, List.of(completed("1200.00", 1)));

        assertTrue(allocation.slots().stream().allMatch(ScheduleSlot::isPaid));
        assertEquals(new BigDecimal("1000.00"), allocation.allocatedAmount());
        assertEquals(new BigDecimal("200.00"), allocation.overflowAmount());
        assertEquals(0, allocation.scheduledTotal().compareTo(new BigDecimal("1000.00")));
        assertTrue(allocation.nextPendingSlot().isEmpty());
    }

    @Test
    void allocate_ignoresPaymentsThatAreNotCompleted() {
        List<Payment> payments = List.of(
                payment("250.00", 1, PaymentStatus.PENDING),
                payment("250.00", 2, PaymentStatus.REJECTED),
                payment("250.00", 3, PaymentStatus.FAILED),
                payment("250.00", 4, PaymentStatus.REFUNDED)
        );

        Allocation allocation = allocator.allocate(schedule, payments);

        assertEquals(0, allocation.allocatedAmount().signum());
        assertTrue(allocation.slots().stream().noneMatch(ScheduleSlot::isPaid));
    }

    @Test
    @DisplayName("Σ pago nas parcelas ≤ Σ pagamentos concluídos, igual sem excedente")
    void allocate_slotPaidNeverExceedsCompletedTotal() {
        List<Payment> payments = List.of(completed("123.45", 1), completed("600.00", 2), completed("500.00", 3));

        Allocation allocation = allocator.allocate(schedule, payments);

        BigDecimal slotPaid = allocation.slots().stream()
                .map(ScheduleSlot::getPaidAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal completed = new BigDecimal("1223.45");
        assertTrue(slotPaid.compareTo(completed) <= 0);
        assertEquals(0, slotPaid.add(allocation.overflowAmount()).compareTo(completed));
    }

    @Test
    void allocate_inputOrderDoesNotMatter() {
        List<Payment> payments = new ArrayList<>(List.of(
                completed("80.00", 3),
                completed("300.00", 1),
                completed("45.50", 2)
        ));

        Allocation first = allocator.allocate(schedule, payments);
        Collections.reverse(payments);
        Allocation second = allocator.allocate(schedule, payments);

        assertEquals(first, second);
        assertEquals(first, allocator.allocate(schedule, payments));
    }

    @Test
    void allocate_sameDate_tieBrokenByCreationTime() {
        Payment later = completed("10.00", 1);
        later.setCreatedAt(LocalDateTime.of(2024, 2, 1, 12, 0));
        Payment earlier = completed("20.00", 1);
        earlier.setCreatedAt(LocalDateTime.of(2024, 2, 1, 9, 0));

        List<Payment> ordered = new ArrayList<>(List.of(later, earlier));
        ordered.sort(PaymentAllocator.ALLOCATION_ORDER);

        assertEquals(earlier, ordered.get(0));
    }

    @Test
    void allocate_noPayments_returnsScheduleUntouched() {
        Allocation allocation = allocator.allocate(schedule, List.of());

        assertEquals(schedule, allocation.slots());
        assertEquals(0, allocation.overflowAmount().signum());
    }

    private Payment completed(String amount, int dayOfFebruary) {
        return payment(amount, dayOfFebruary, PaymentStatus.COMPLETED);
    }

    private Payment payment(String amount, int dayOfFebruary, PaymentStatus status) {
        return Payment.builder()
                .amount(new BigDecimal(amount))
                .currency("PHP")
                .paymentDate(LocalDate.of(2024, 2, dayOfFebruary))
                .paymentMethod(PaymentMethod.CASH)
                .status(status)
                .createdAt(LocalDateTime.of(2024, 2, dayOfFebruary, 10, 0))
                .build();
    }
}
