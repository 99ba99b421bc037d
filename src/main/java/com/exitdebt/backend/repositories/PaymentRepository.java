package com.exitdebt.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.exitdebt.backend.entities.Payment;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    @Query("SELECT p FROM Payment p JOIN FETCH p.debt d WHERE p.id = :id AND d.ownerId = :ownerId")
    Optional<Payment> findByIdAndOwnerId(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    List<Payment> findByDebtIdOrderByPaymentDateDescCreatedAtDesc(UUID debtId);

    /**
     * Pagamentos concluídos na ordem de alocação: data do pagamento e, no empate, ordem de criação.
     */
    @Query("""
            SELECT p FROM Payment p
            WHERE p.debt.id = :debtId
              AND p.status = com.exitdebt.backend.enums.PaymentStatus.COMPLETED
            ORDER BY p.paymentDate ASC, p.createdAt ASC
            """)
    List<Payment> findCompletedForAllocation(@Param("debtId") UUID debtId);

    @Query("""
            SELECT p FROM Payment p
            WHERE p.debt.id IN :debtIds
              AND p.status = com.exitdebt.backend.enums.PaymentStatus.COMPLETED
            ORDER BY p.paymentDate ASC, p.createdAt ASC
            """)
    List<Payment> findCompletedForAllocation(@Param("debtIds") Collection<UUID> debtIds);

    @Query("""
            SELECT COALESCE(SUM(p.amount), 0) FROM Payment p
            WHERE p.debt.id = :debtId
              AND p.status = com.exitdebt.backend.enums.PaymentStatus.COMPLETED
            """)
    BigDecimal sumCompletedAmount(@Param("debtId") UUID debtId);

    @Query("""
            SELECT MAX(p.paymentDate) FROM Payment p
            WHERE p.debt.id = :debtId
              AND p.status = com.exitdebt.backend.enums.PaymentStatus.COMPLETED
            """)
    Optional<LocalDate> findLastCompletedPaymentDate(@Param("debtId") UUID debtId);

    @Query("""
            SELECT p FROM Payment p JOIN FETCH p.debt d
            WHERE d.ownerId = :ownerId
              AND p.status = com.exitdebt.backend.enums.PaymentStatus.PENDING
            ORDER BY p.paymentDate ASC
            """)
    List<Payment> findPendingByOwner(@Param("ownerId") UUID ownerId);
}
