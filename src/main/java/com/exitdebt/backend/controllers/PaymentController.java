package com.exitdebt.backend.controllers;

import com.exitdebt.backend.config.OpenApiConfig;
import com.exitdebt.backend.dto.ApiResponse;
import com.exitdebt.backend.dto.payment.PaymentRequestDTO;
import com.exitdebt.backend.dto.payment.PaymentResponseDTO;
import com.exitdebt.backend.dto.payment.PaymentUpdateRequestDTO;
import com.exitdebt.backend.dto.payment.PaymentVerificationRequestDTO;
import com.exitdebt.backend.services.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> create(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @Valid @RequestBody PaymentRequestDTO dto
    ) {
        PaymentResponseDTO created = paymentService.create(ownerId, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Pagamento registrado com sucesso"));
    }

    @GetMapping("/pending-verification")
    public ResponseEntity<ApiResponse<List<PaymentResponseDTO>>> findPendingVerification(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId
    ) {
        List<PaymentResponseDTO> list = paymentService.findPendingVerification(ownerId);
        return ResponseEntity.ok(ApiResponse.success(list, "Pagamentos pendentes de verificação"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> findById(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        PaymentResponseDTO dto = paymentService.findById(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(dto, "Pagamento encontrado"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> update(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id,
            @Valid @RequestBody PaymentUpdateRequestDTO dto
    ) {
        PaymentResponseDTO updated = paymentService.update(ownerId, id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Pagamento atualizado com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id
    ) {
        paymentService.delete(ownerId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Pagamento deletado com sucesso"));
    }

    @PostMapping("/{id}/verify")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> verify(
            @RequestHeader(OpenApiConfig.OWNER_HEADER) String ownerId,
            @PathVariable String id,
            @Valid @RequestBody PaymentVerificationRequestDTO dto
    ) {
        PaymentResponseDTO verified = paymentService.verify(ownerId, id, dto);
        return ResponseEntity.ok(ApiResponse.success(verified, "Pagamento verificado"));
    }
}
