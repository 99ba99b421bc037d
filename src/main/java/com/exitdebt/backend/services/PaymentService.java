package com.exitdebt.backend.services;

import com.exitdebt.backend.audit.Auditable;
import com.exitdebt.backend.dto.payment.PaymentRequestDTO;
import com.exitdebt.backend.dto.payment.PaymentResponseDTO;
import com.exitdebt.backend.dto.payment.PaymentUpdateRequestDTO;
import com.exitdebt.backend.dto.payment.PaymentVerificationRequestDTO;
import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.entities.Payment;
import com.exitdebt.backend.enums.DebtType;
import com.exitdebt.backend.enums.PaymentStatus;
import com.exitdebt.backend.exceptions.BadRequestException;
import com.exitdebt.backend.exceptions.BusinessException;
import com.exitdebt.backend.exceptions.ResourceNotFoundException;
import com.exitdebt.backend.mappers.PaymentMapper;
import com.exitdebt.backend.repositories.DebtRepository;
import com.exitdebt.backend.repositories.PaymentRepository;
import com.exitdebt.backend.services.schedule.LedgerReconciler;
import com.exitdebt.backend.services.schedule.LedgerTransactionRunner;
import com.exitdebt.backend.services.schedule.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Pagamentos de uma dívida. Toda escrita trava a dívida, grava o pagamento e reconcilia o
 * razão na mesma transação.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final DebtRepository debtRepository;
    private final LedgerReconciler ledgerReconciler;
    private final LedgerTransactionRunner ledgerTransactionRunner;
    private final Clock clock;

    @Auditable(action = "PAYMENT_CREATED", entityType = "Payment")
    public PaymentResponseDTO create(String ownerId, PaymentRequestDTO dto) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID debtUuid = parseUuid(dto.getDebtId(), "debtId");
        validateRequired(dto);

        return ledgerTransactionRunner.execute("registro de pagamento na dívida " + debtUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);

            Payment payment = Payment.builder()
                    .debt(debt)
                    .amount(Money.requirePositive(dto.getAmount(), "Valor do pagamento"))
                    .currency(resolveCurrency(dto.getCurrency(), debt))
                    .paymentDate(dto.getPaymentDate())
                    .paymentMethod(dto.getPaymentMethod())
                    .status(initialStatus(debt))
                    .description(dto.getDescription())
                    .receiptUrl(dto.getReceiptUrl())
                    // Desempate da ordem de alocação entre pagamentos da mesma data
                    .createdAt(LocalDateTime.now(clock))
                    .build();

            Payment saved = paymentRepository.save(payment);
            ledgerReconciler.reconcile(debt);

            log.info("Pagamento {} de {} registrado na dívida {} com status {}",
                    saved.getId(), saved.getAmount(), debt.getId(), saved.getStatus());
            return PaymentMapper.toResponseDTO(saved);
        });
    }

    @Transactional(readOnly = true)
    public PaymentResponseDTO findById(String ownerId, String id) {
        return PaymentMapper.toResponseDTO(findPaymentOrThrow(ownerId, id));
    }

    @Transactional(readOnly = true)
    public List<PaymentResponseDTO> findByDebt(String ownerId, String debtId) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID debtUuid = parseUuid(debtId, "debtId");
        if (debtRepository.findByIdAndOwnerId(debtUuid, ownerUuid).isEmpty()) {
            throw new ResourceNotFoundException("Dívida não encontrada");
        }

        return paymentRepository.findByDebtIdOrderByPaymentDateDescCreatedAtDesc(debtUuid)
                .stream()
                .map(PaymentMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentResponseDTO> findPendingVerification(String ownerId) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        return paymentRepository.findPendingByOwner(ownerUuid)
                .stream()
                .map(PaymentMapper::toResponseDTO)
                .toList();
    }

    @Auditable(action = "PAYMENT_UPDATED", entityType = "Payment")
    public PaymentResponseDTO update(String ownerId, String id, PaymentUpdateRequestDTO dto) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID paymentUuid = parseUuid(id, "id");
        UUID debtUuid = findDebtIdOrThrow(paymentUuid, ownerUuid);

        return ledgerTransactionRunner.execute("atualização do pagamento " + paymentUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);
            Payment payment = reloadPaymentOrThrow(paymentUuid, debt);

            if (dto.getAmount() != null) {
                payment.setAmount(Money.requirePositive(dto.getAmount(), "Valor do pagamento"));
            }
            if (dto.getCurrency() != null) {
                payment.setCurrency(resolveCurrency(dto.getCurrency(), debt));
            }
            if (dto.getPaymentDate() != null) {
                payment.setPaymentDate(dto.getPaymentDate());
            }
            if (dto.getPaymentMethod() != null) {
                payment.setPaymentMethod(dto.getPaymentMethod());
            }
            if (dto.getStatus() != null) {
                payment.setStatus(dto.getStatus());
            }
            if (dto.getDescription() != null) {
                payment.setDescription(dto.getDescription());
            }
            if (dto.getReceiptUrl() != null) {
                payment.setReceiptUrl(dto.getReceiptUrl());
            }

            Payment saved = paymentRepository.save(payment);
            ledgerReconciler.reconcile(debt);
            return PaymentMapper.toResponseDTO(saved);
        });
    }

    @Auditable(action = "PAYMENT_DELETED", entityType = "Payment")
    public void delete(String ownerId, String id) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID paymentUuid = parseUuid(id, "id");
        UUID debtUuid = findDebtIdOrThrow(paymentUuid, ownerUuid);

        ledgerTransactionRunner.run("exclusão do pagamento " + paymentUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);
            Payment payment = reloadPaymentOrThrow(paymentUuid, debt);

            paymentRepository.delete(payment);
            paymentRepository.flush();
            ledgerReconciler.reconcile(debt);
        });
    }

    /**
     * Confirma ou rejeita um pagamento pendente e registra quem verificou.
     */
    @Auditable(action = "PAYMENT_VERIFIED", entityType = "Payment")
    public PaymentResponseDTO verify(String ownerId, String id, PaymentVerificationRequestDTO dto) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID paymentUuid = parseUuid(id, "id");
        if (dto.getStatus() != PaymentStatus.COMPLETED && dto.getStatus() != PaymentStatus.REJECTED) {
            throw new BadRequestException("Status de verificação deve ser COMPLETED ou REJECTED");
        }
        UUID debtUuid = findDebtIdOrThrow(paymentUuid, ownerUuid);

        return ledgerTransactionRunner.execute("verificação do pagamento " + paymentUuid, () -> {
            Debt debt = findLockedDebtOrThrow(debtUuid, ownerUuid);
            Payment payment = reloadPaymentOrThrow(paymentUuid, debt);

            if (payment.getStatus() != PaymentStatus.PENDING) {
                throw new BusinessException("Apenas pagamentos pendentes podem ser verificados (status atual: "
                        + payment.getStatus() + ")");
            }

            payment.setStatus(dto.getStatus());
            payment.setVerifiedBy(ownerUuid);
            payment.setVerifiedAt(LocalDateTime.now(clock));
            payment.setVerificationNotes(dto.getVerificationNotes());

            Payment saved = paymentRepository.save(payment);
            ledgerReconciler.reconcile(debt);

            log.info("Pagamento {} verificado como {} por {}", paymentUuid, dto.getStatus(), ownerUuid);
            return PaymentMapper.toResponseDTO(saved);
        });
    }

    // Dono registrando pagamento que ele deve: aguarda confirmação
    static PaymentStatus initialStatus(Debt debt) {
        return debt.getDebtType() == DebtType.I_OWE ? PaymentStatus.PENDING : PaymentStatus.COMPLETED;
    }

    private void validateRequired(PaymentRequestDTO dto) {
        if (dto.getPaymentDate() == null) {
            throw new BadRequestException("Data do pagamento é obrigatória");
        }
        if (dto.getPaymentMethod() == null) {
            throw new BadRequestException("Forma de pagamento é obrigatória");
        }
    }

    private String resolveCurrency(String raw, Debt debt) {
        if (raw == null || raw.isBlank()) {
            return debt.getCurrency();
        }
        String currency = raw.trim().toUpperCase(Locale.ROOT);
        if (!currency.equals(debt.getCurrency())) {
            throw new BadRequestException("Moeda do pagamento (" + currency
                    + ") difere da moeda da dívida (" + debt.getCurrency() + ")");
        }
        return currency;
    }

    private Payment findPaymentOrThrow(String ownerId, String id) {
        UUID ownerUuid = parseUuid(ownerId, "ownerId");
        UUID paymentUuid = parseUuid(id, "id");
        return paymentRepository.findByIdAndOwnerId(paymentUuid, ownerUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Pagamento não encontrado"));
    }

    private UUID findDebtIdOrThrow(UUID paymentId, UUID ownerId) {
        return paymentRepository.findByIdAndOwnerId(paymentId, ownerId)
                .map(payment -> payment.getDebt().getId())
                .orElseThrow(() -> new ResourceNotFoundException("Pagamento não encontrado"));
    }

    private Debt findLockedDebtOrThrow(UUID debtId, UUID ownerId) {
        return debtRepository.findByIdAndOwnerIdForUpdate(debtId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Dívida não encontrada"));
    }

    // Relido depois do lock da dívida
    private Payment reloadPaymentOrThrow(UUID paymentId, Debt debt) {
        return paymentRepository.findById(paymentId)
                .filter(payment -> payment.getDebt().getId().equals(debt.getId()))
                .orElseThrow(() -> new ResourceNotFoundException("Pagamento não encontrado"));
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
