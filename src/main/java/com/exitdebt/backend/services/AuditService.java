package com.exitdebt.backend.services;

import com.exitdebt.backend.entities.AuditEvent;
import com.exitdebt.backend.enums.AuditEventStatus;
import com.exitdebt.backend.repositories.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    @Async("auditTaskExecutor")
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(AuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (Exception e) {
            // Falha de auditoria não desfaz a operação auditada
            log.error("Falha ao salvar evento de auditoria: action={}, entityId={}",
                    event.getAction(), event.getEntityId(), e);
        }
    }

    public AuditEvent createEvent(
            String ownerId,
            String ipAddress,
            String action,
            String entityId,
            String entityType,
            Map<String, Object> details,
            AuditEventStatus status,
            String errorMessage
    ) {
        return AuditEvent.builder()
                .timestamp(LocalDateTime.now(clock))
                .ownerId(ownerId)
                .ipAddress(ipAddress)
                .action(action)
                .entityId(entityId)
                .entityType(entityType)
                .details(details)
                .status(status)
                .errorMessage(truncate(errorMessage))
                .build();
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }
}
