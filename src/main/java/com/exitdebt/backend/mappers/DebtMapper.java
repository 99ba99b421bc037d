package com.exitdebt.backend.mappers;

import com.exitdebt.backend.dto.debt.DebtResponseDTO;
import com.exitdebt.backend.dto.debt.ScheduleSlotDTO;
import com.exitdebt.backend.dto.debt.UpcomingPaymentDTO;
import com.exitdebt.backend.entities.Debt;
import com.exitdebt.backend.services.schedule.ScheduleSlot;
import com.exitdebt.backend.services.schedule.UpcomingInstallment;

public class DebtMapper {

    private DebtMapper() {}

    public static DebtResponseDTO toResponseDTO(Debt debt) {
        DebtResponseDTO dto = new DebtResponseDTO();

        dto.setId(debt.getId().toString());
        dto.setOwnerId(debt.getOwnerId().toString());
        dto.setCounterpartyId(debt.getCounterpartyId().toString());
        dto.setDebtType(debt.getDebtType());
        dto.setTotalAmount(debt.getTotalAmount());
        dto.setInstallmentAmount(debt.getInstallmentAmount());
        dto.setCurrency(debt.getCurrency());
        dto.setCadence(debt.getCadence());
        dto.setPlanBasis(debt.getPlanBasis());
        dto.setNumberOfPayments(debt.getNumberOfPayments());
        dto.setDueDate(debt.getDueDate());
        dto.setPaidTotal(debt.getPaidTotal());
        dto.setRemainingTotal(debt.getRemainingTotal());
        dto.setStatus(debt.getStatus());
        dto.setNextPaymentDate(debt.getNextPaymentDate());
        dto.setDescription(debt.getDescription());
        dto.setNotes(debt.getNotes());
        dto.setCreatedAt(debt.getCreatedAt());
        dto.setUpdatedAt(debt.getUpdatedAt());

        return dto;
    }

    public static ScheduleSlotDTO toSlotDTO(ScheduleSlot slot) {
        return ScheduleSlotDTO.builder()
                .paymentNumber(slot.getPaymentNumber())
                .dueDate(slot.getDueDate())
                .scheduledAmount(slot.getScheduledAmount())
                .paidAmount(slot.getPaidAmount())
                .remainingAmount(slot.getRemainingAmount())
                .status(slot.getStatus())
                .build();
    }

    public static UpcomingPaymentDTO toUpcomingDTO(UpcomingInstallment item) {
        Debt debt = item.debt();
        ScheduleSlot slot = item.slot();
        return UpcomingPaymentDTO.builder()
                .debtId(debt.getId().toString())
                .counterpartyId(debt.getCounterpartyId().toString())
                .debtType(debt.getDebtType())
                .paymentNumber(slot.getPaymentNumber())
                .dueDate(slot.getDueDate())
                .amountDue(slot.getRemainingAmount())
                .currency(debt.getCurrency())
                .description(debt.getDescription())
                .build();
    }
}
