package com.exitdebt.backend.services;

import com.exitdebt.backend.audit.Auditable;
import com.exitdebt.backend.config.ScheduleProperties;
import com.exitdebt.backend.dto.debt.DebtRequestDTO;
import com.exitdebt.backend.dto.debt.DebtResponseDTO;
import com.exitdebt.backend.dto.debt.DebtUpdateRequestDTO;
import com.exitdebt.backend.dto.debt.PaymentScheduleDTO;
import com.exitdebt.backend.dto.debt.PaymentSummaryDTO;
import com.exitdebt.backend.dto.debt.UpcomingPaymentDTO;
import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.entities.Payment;
import com.exitdebt.backend.enums.DebtStatus;
import com.exitdebt.backend.enums.PaymentStatus;
import com.exitdebt.backend.enums.PlanBasis;
import com.exitdebt.backend.exceptions.BadRequestException;
import com.exitdebt.backend.exceptions.ResourceNotFoundException;
import com.exitdebt.backend.mappers.DebtMapper;
import com.exitdebt.backend.mappers.PaymentMapper;
import com.exitdebt.backend.repositories.DebtRepository;
import com.exitdebt.backend.repositories.PaymentRepository;
import com.exitdebt.backend.services.schedule.Allocation;
import com.exitdebt.backend.services.schedule.LedgerReconciler;
import com.exitdebt.backend.services.schedule.LedgerTransactionRunner;
import com.exitdebt.backend.services.schedule.Money;
import com.exitdebt.backend.services.schedule.NormalizedPlan;
import com.exitdebt.backend.services.schedule.PaymentAllocator;
import com.exitdebt.backend.services.schedule.PlanNormalizer;
import com.exitdebt.backend.services.schedule.PlanRequest;
import com.exitdebt.backend.services.schedule.ScheduleBuilder;
import com.exitdebt.backend.services.schedule.ScheduleSlot;
import com.exitdebt.backend.services.schedule.TimeWindowClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DebtService {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final DebtRepository debtRepository;
    private final PaymentRepository paymentRepository;
    private final PlanNormalizer planNormalizer;
    private final ScheduleBuilder scheduleBuilder;
    private final PaymentAllocator paymentAllocator;
    private final LedgerReconciler ledgerReconciler;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final TimeWindowClassifier timeWindowClassifier;
    private final ScheduleProperties scheduleProperties;
    private final Clock clock;

    @Auditable(action = "DEBT_CREATED", entityType = "Debt")
    public DebtResponseDTO create(String ownerId, DebtRequestDTO dto) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID counterpartyUuid = parseUuid(dto.getCounterpartyId(), "counterpartyId");
        if (dto.getDebtType() == null) {
            throw new BadRequestException("Tipo da dívida é obrigatório");
        }

        LocalDateTime createdAt = LocalDateTime.now(clock);
        NormalizedPlan plan = planNormalizer.normalize(PlanRequest.builder()
                .totalAmount(dto.getTotalAmount())
                .cadence(dto.getCadence())
                .anchorDate(createdAt.toLocalDate())
                .dueDate(dto.getDueDate())
                .numberOfPayments(dto.getNumberOfPayments())
                .build());

        Debt debt = new Debt();
        debt.setOwnerId(ownerUuid);
        debt.setCounterpartyId(counterpartyUuid);
        debt.setDebtType(dto.getDebtType());
        debt.setCurrency(resolveCurrency(dto.getCurrency()));
        debt.setDescription(dto.getDescription());
        debt.setNotes(dto.getNotes());
        debt.setCreatedAt(createdAt);
        plan.applyTo(debt);

        // Razão inicial; o reconciliador confirma dentro da transação
        debt.setPaidTotal(Money.ZERO);
        debt.setRemainingTotal(plan.getTotalAmount());
        debt.setStatus(DebtStatus.ACTIVE);
        debt.setNextPaymentDate(planNormalizer.nextPaymentDate(plan, null));

        return ledgerTransactionRunner.execute("criação de dívida", () -> {
            Debt saved = debtRepository.save(debt);
            Debt reconciled = ledgerReconciler.reconcile(saved);
            log.info("Dívida {} criada: total={}, parcelas={}, cadence={}",
                    reconciled.getId(), reconciled.getTotalAmount(),
                    reconciled.getNumberOfPayments(), reconciled.getCadence());
            return DebtMapper.toResponseDTO(reconciled);
        });
    }

    @Transactional(readOnly = true)
    public DebtResponseDTO findById(String ownerId, String id) {
        return DebtMapper.toResponseDTO(findDebtOrThrow(ownerId, id));
    }

    @Transactional(readOnly = true)
    public List<DebtResponseDTO> findByOwner(String ownerId) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        return debtRepository.findByOwnerIdOrderByCreatedAtDesc(ownerUuid)
                .stream()
                .map(DebtMapper::toResponseDTO)
                .toList();
    }

    @Auditable(action = "DEBT_UPDATED", entityType = "Debt")
    public DebtResponseDTO update(String ownerId, String id, DebtUpdateRequestDTO dto) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID debtUuid = parseUuid(id, "id");

        if (dto.getDueDate() != null && dto.getNumberOfPayments() != null) {
            throw new BadRequestException("Informe apenas a data de vencimento ou o número de parcelas");
        }
        if (dto.getStatus() != null
                && dto.getStatus() != DebtStatus.ARCHIVED
                && dto.getStatus() != DebtStatus.ACTIVE) {
            throw new BadRequestException("Status " + dto.getStatus() + " é calculado e não pode ser definido manualmente");
        }

        return ledgerTransactionRunner.execute("atualização da dívida " + debtUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);

            if (affectsPlan(dto)) {
                NormalizedPlan plan = planNormalizer.normalize(replanRequest(debt, dto));
                plan.applyTo(debt);
            }

            if (dto.getCurrency() != null) {
                debt.setCurrency(resolveCurrency(dto.getCurrency()));
            }
            if (dto.getDescription() != null) {
                debt.setDescription(dto.getDescription());
            }
            if (dto.getNotes() != null) {
                debt.setNotes(dto.getNotes());
            }

            if (dto.getStatus() == DebtStatus.ARCHIVED) {
                debt.setStatus(DebtStatus.ARCHIVED);
            } else if (dto.getStatus() == DebtStatus.ACTIVE && debt.getStatus() == DebtStatus.ARCHIVED) {
                // Desarquivar: o reconciliador recalcula o status real
                debt.setStatus(DebtStatus.ACTIVE);
            }

            return DebtMapper.toResponseDTO(ledgerReconciler.reconcile(debt));
        });
    }

    @Auditable(action = "DEBT_DELETED", entityType = "Debt")
    public void delete(String ownerId, String id) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID debtUuid = parseUuid(id, "id");

        ledgerTransactionRunner.run("exclusão da dívida " + debtUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);
            debtRepository.delete(debt);
            log.info("Dívida {} excluída com seus pagamentos", debtUuid);
        });
    }

    @Transactional(readOnly = true)
    public PaymentScheduleDTO getSchedule(String ownerId, String id) {
        Debt debt = findDebtOrThrow(ownerId, id);
        Allocation allocation = allocate(debt);

        return PaymentScheduleDTO.builder()
                .debtId(debt.getId().toString())
                .currency(debt.getCurrency())
                .totalAmount(debt.getTotalAmount())
                .installmentAmount(debt.getInstallmentAmount())
                .numberOfPayments(debt.getNumberOfPayments())
                .slots(allocation.slots().stream().map(DebtMapper::toSlotDTO).toList())
                .overflowAmount(allocation.overflowAmount())
                .build();
    }

    @Transactional(readOnly = true)
    public PaymentSummaryDTO getSummary(String ownerId, String id) {
        Debt debt = findDebtOrThrow(ownerId, id);
        Allocation allocation = allocate(debt);
        List<Payment> payments = paymentRepository.findByDebtIdOrderByPaymentDateDescCreatedAtDesc(debt.getId());

        return PaymentSummaryDTO.builder()
                .debtId(debt.getId().toString())
                .currency(debt.getCurrency())
                .totalAmount(debt.getTotalAmount())
                .totalPaid(debt.getPaidTotal())
                .remainingDebt(debt.getRemainingTotal())
                .percentagePaid(percentagePaid(debt.getPaidTotal(), debt.getTotalAmount()))
                .numberOfPayments((int) payments.stream()
                        .filter(payment -> payment.getStatus() == PaymentStatus.COMPLETED)
                        .count())
                .nextInstallment(allocation.nextPendingSlot().map(DebtMapper::toSlotDTO).orElse(null))
                .payments(payments.stream().map(PaymentMapper::toResponseDTO).toList())
                .build();
    }

    @Transactional(readOnly = true)
    public List<DebtResponseDTO> findOverdue(String ownerId) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        return timeWindowClassifier.overdue(ownerUuid)
                .stream()
                .map(DebtMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DebtResponseDTO> findDueSoon(String ownerId, Integer days) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        int window = days != null ? days : scheduleProperties.dueSoonDays();
        return timeWindowClassifier.dueSoon(ownerUuid, window)
                .stream()
                .map(DebtMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UpcomingPaymentDTO> findUpcomingPayments(String ownerId, Integer days) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        int window = days != null ? days : scheduleProperties.upcomingDays();
        return timeWindowClassifier.upcoming(ownerUuid, window)
                .stream()
                .map(DebtMapper::toUpcomingDTO)
                .toList();
    }

    static BigDecimal percentagePaid(BigDecimal paid, BigDecimal total) {
        if (total == null || total.signum() == 0) {
            return Money.ZERO;
        }
        return paid.multiply(ONE_HUNDRED).divide(total, Money.SCALE, RoundingMode.HALF_UP);
    }

    private Allocation allocate(Debt debt) {
        List<ScheduleSlot> schedule = scheduleBuilder.build(NormalizedPlan.fromDebt(debt));
        return paymentAllocator.allocate(schedule, paymentRepository.findCompletedForAllocation(debt.getId()));
    }

    private boolean affectsPlan(DebtUpdateRequestDTO dto) {
        return dto.getTotalAmount() != null
                || dto.getCadence() != null
                || dto.getDueDate() != null
                || dto.getNumberOfPayments() != null;
    }

    private PlanRequest replanRequest(Debt debt, DebtUpdateRequestDTO dto) {
        PlanRequest.PlanRequestBuilder request = PlanRequest.builder()
                .totalAmount(dto.getTotalAmount() != null ? dto.getTotalAmount() : debt.getTotalAmount())
                .cadence(dto.getCadence() != null ? dto.getCadence() : debt.getCadence())
                .anchorDate(debt.getCreatedAt().toLocalDate());

        // Sem novo prazo ou nova quantidade, mantém a base do plano atual
        if (dto.getDueDate() != null) {
            request.dueDate(dto.getDueDate());
        } else if (dto.getNumberOfPayments() != null) {
            request.numberOfPayments(dto.getNumberOfPayments());
        } else if (debt.getPlanBasis() == PlanBasis.DUE_DATE) {
            request.dueDate(debt.getDueDate());
        } else {
            request.numberOfPayments(debt.getNumberOfPayments());
        }
        return request.build();
    }

    private String resolveCurrency(String raw) {
        if (raw == null || raw.isBlank()) {
            return scheduleProperties.defaultCurrency();
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    private Debt findDebtOrThrow(String ownerId, String id) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID debtUuid = parseUuid(id, "id");
        return debtRepository.findByIdAndOwnerId(debtUuid, ownerUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Dívida não encontrada"));
    }

    private Debt findLockedDebtOrThrow(UUID debtId, UUID ownerId) {
        return debtRepository.findByIdAndOwnerIdForUpdate(debtId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Dívida não encontrada"));
    }

    private UUID parseUuid(String raw, String fieldName) {
        if (raw == null || raw.isBlank()) {
            throw new BadRequestException(fieldName + " é obrigatório");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(fieldName + " inválido");
        }
    }
}
