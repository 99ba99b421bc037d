package com.exitdebt.backend.audit;

import com.exitdebt.backend.config.OpenApiConfig;
import com.exitdebt.backend.entities.AuditEvent;
import com.exitdebt.backend.enums.AuditEventStatus;
import com.exitdebt.backend.services.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class AuditAspect {

    static final String UNKNOWN_OWNER = "UNKNOWN";

    private final AuditService auditService;

    @Around("@annotation(auditable)")
    public Object audit(ProceedingJoinPoint joinPoint, Auditable auditable) throws Throwable {
        HttpServletRequest request = currentRequest();
        String ownerId = resolveOwnerId(request, joinPoint.getArgs());
        String ipAddress = resolveClientIp(request);

        Map<String, Object> details = new HashMap<>();
        AuditEventStatus status = AuditEventStatus.SUCCESS;
        String entityId = null;
        String errorMessage = null;

        try {
            Object[] args = joinPoint.getArgs();
            if (args != null && args.length > 0) {
                details.put("arguments", extractRelevantArguments(args));
            }

            Object result = joinPoint.proceed();

            entityId = extractEntityId(result);
            if (entityId == null) {
                // delete: o id vem no último argumento
                entityId = lastUuidArgument(args);
            }
            details.put("result", "Operation completed successfully");

            return result;
        } catch (Exception e) {
            status = AuditEventStatus.FAILURE;
            errorMessage = e.getMessage();
            details.put("errorType", e.getClass().getSimpleName());
            throw e;
        } finally {
            AuditEvent event = auditService.createEvent(
                    ownerId,
                    ipAddress,
                    auditable.action(),
                    entityId,
                    auditable.entityType(),
                    details,
                    status,
                    errorMessage
            );
            auditService.logEvent(event);
        }
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes != null ? attributes.getRequest() : null;
    }

    private String resolveOwnerId(HttpServletRequest request, Object[] args) {
        if (request != null) {
            String header = request.getHeader(OpenApiConfig.OWNER_HEADER);
            if (header != null && !header.isBlank()) {
                return header.trim();
            }
        }
        // Chamadas fora de uma requisição HTTP: os serviços recebem o dono como primeiro argumento
        if (args != null && args.length > 0 && isUuid(args[0])) {
            return args[0].toString();
        }
        return UNKNOWN_OWNER;
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN_OWNER;
        }
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private String lastUuidArgument(Object[] args) {
        if (args == null) return null;
        for (int i = args.length - 1; i >= 0; i--) {
            if (isUuid(args[i])) {
                return args[i].toString();
            }
        }
        return null;
    }

    private boolean isUuid(Object arg) {
        if (arg instanceof UUID) return true;
        if (!(arg instanceof String raw)) return false;
        try {
            UUID.fromString(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private String extractEntityId(Object result) {
        if (result == null) return null;
        try {
            Method getIdMethod = result.getClass().getMethod("getId");
            Object id = getIdMethod.invoke(result);
            return id != null ? id.toString() : null;
        } catch (ReflectiveOperationException e) {
            log.debug("Resultado {} sem getId()", result.getClass().getSimpleName());
            return null;
        }
    }

    private Map<String, Object> extractRelevantArguments(Object[] args) {
        Map<String, Object> relevant = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg == null) continue;

            if (arg instanceof String || arg instanceof Number || arg instanceof Boolean
                    || arg instanceof UUID || arg instanceof BigDecimal) {
                relevant.put("arg" + i, arg.toString());
            } else {
                relevant.put("arg" + i + "_type", arg.getClass().getSimpleName());
            }
        }
        return relevant;
    }
}
