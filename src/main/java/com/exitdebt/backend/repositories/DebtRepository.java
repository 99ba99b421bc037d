package com.exitdebt.backend.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.exitdebt.backend.entities.Debt;

import jakarta.persistence.LockModeType;

public interface DebtRepository extends JpaRepository<Debt, UUID> {

    Optional<Debt> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<Debt> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    /**
     * Carrega a dívida com lock de escrita na linha; toda alteração do razão passa por aqui.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Debt d WHERE d.id = :id AND d.ownerId = :ownerId")
    Optional<Debt> findByIdAndOwnerIdForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    @Query("""
            SELECT d FROM Debt d
            WHERE d.ownerId = :ownerId
              AND d.status <> com.exitdebt.backend.enums.DebtStatus.ARCHIVED
              AND d.remainingTotal > 0
              AND d.dueDate < :today
            ORDER BY d.dueDate ASC
            """)
    List<Debt> findOverdue(@Param("ownerId") UUID ownerId, @Param("today") LocalDate today);

    @Query("""
            SELECT d FROM Debt d
            WHERE d.ownerId = :ownerId
              AND d.status <> com.exitdebt.backend.enums.DebtStatus.ARCHIVED
              AND d.remainingTotal > 0
              AND d.dueDate BETWEEN :today AND :until
            ORDER BY d.dueDate ASC
            """)
    List<Debt> findDueBetween(
            @Param("ownerId") UUID ownerId,
            @Param("today") LocalDate today,
            @Param("until") LocalDate until
    );

    @Query("""
            SELECT d FROM Debt d
            WHERE d.ownerId = :ownerId
              AND d.status <> com.exitdebt.backend.enums.DebtStatus.ARCHIVED
              AND d.remainingTotal > 0
            """)
    List<Debt> findOpenByOwner(@Param("ownerId") UUID ownerId);
}
