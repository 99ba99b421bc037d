package com.exitdebt.backend.controllers;

import com.exitdebt.backend.config.OpenApiConfig;
import com.exitdebt.backend.dto.ApiResponse;
import com.exitdebt.backend.dto.debt.DebtRequestDTO;
import com.exitdebt.backend.dto.debt.DebtResponseDTO;
import com.exitdebt.backend.dto.debt.DebtUpdateRequestDTO;
import com.exitdebt.backend.dto.debt.PaymentScheduleDTO;
import com.exitdebt.backend.dto.debt.PaymentSummaryDTO;
import com.exitdebt.backend.dto.debt.UpcomingPaymentDTO;
import com.exitdebt.backend.dto.payment.PaymentResponseDTO;
import com.exitdebt.backend.services.DebtService;
import com.exitdebt.backend.services.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/debts")
@RequiredArgsConstructor
public class DebtController {

    private final DebtService debtService;
    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<ApiResponse<DebtResponseDTO>> create(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @Valid @RequestBody DebtRequestDTO dto
    ) {
        DebtResponseDTO created = debtService.create(ownerId, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Dívida criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<DebtResponseDTO>>> findAll(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId
    ) {
        List<DebtResponseDTO> list = debtService.findByOwner(ownerId);
        return ResponseEntity.ok(ApiResponse.success(list, "Dívidas encontradas"));
    }

    @GetMapping("/overdue")
    public ResponseEntity<ApiResponse<List<DebtResponseDTO>>> findOverdue(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId
    ) {
        List<DebtResponseDTO> list = debtService.findOverdue(ownerId);
        return ResponseEntity.ok(ApiResponse.success(list, "Dívidas em atraso encontradas"));
    }

    @GetMapping("/due-soon")
    public ResponseEntity<ApiResponse<List<DebtResponseDTO>>> findDueSoon(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @RequestParam(required = false) Integer days
    ) {
        List<DebtResponseDTO> list = debtService.findDueSoon(ownerId, days);
        return ResponseEntity.ok(ApiResponse.success(list, "Dívidas a vencer encontradas"));
    }

    @GetMapping("/upcoming-payments")
    public ResponseEntity<ApiResponse<List<UpcomingPaymentDTO>>> findUpcomingPayments(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @RequestParam(required = false) Integer days
    ) {
        List<UpcomingPaymentDTO> list = debtService.findUpcomingPayments(ownerId, days);
        return ResponseEntity.ok(ApiResponse.success(list, "Próximas parcelas encontradas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DebtResponseDTO>> findById(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        DebtResponseDTO dto = debtService.findById(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(dto, "Dívida encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<DebtResponseDTO>> update(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id,
            @Valid @RequestBody DebtUpdateRequestDTO dto
    ) {
        DebtResponseDTO updated = debtService.update(ownerId, id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Dívida atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        debtService.delete(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Dívida deletada com sucesso"));
    }

    @GetMapping("/{id}/schedule")
    public ResponseEntity<ApiResponse<PaymentScheduleDTO>> getSchedule(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        PaymentScheduleDTO schedule = debtService.getSchedule(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(schedule, "Cronograma calculado"));
    }

    @GetMapping("/{id}/summary")
    public ResponseEntity<ApiResponse<PaymentSummaryDTO>> getSummary(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        PaymentSummaryDTO summary = debtService.getSummary(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(summary, "Resumo de pagamentos calculado"));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<List<PaymentResponseDTO>>> findPayments(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        List<PaymentResponseDTO> list = paymentService.findByDebt(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(list, "Pagamentos encontrados"));
    }
}
