package com.sldce.backend.audit;

import com.sldce.backend.entities.AuditEvent;
import com.sldce.backend.enums.AuditEventStatus;
import com.sldce.backend.services.AuditService;
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
import java.util.HashMap;
import java.util.Map;

/**
 * Writes one {@link AuditEvent} per call of an {@link Auditable} method, successful or not.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class AuditAspect {

    static final String ACTOR_HEADER = "X-Actor";
    static final String ANONYMOUS = "ANONYMOUS";

    private final AuditService auditService;

    @Around("@annotation(auditable)")
    public Object audit(ProceedingJoinPoint joinPoint, Auditable auditable) throws Throwable {
        HttpServletRequest request = currentRequest();
        String actor = resolveActor(request);
        String ipAddress = resolveClientIp(request);

        Map<String, Object> details = new HashMap<>();
        AuditEventStatus status = AuditEventStatus.SUCCESS;
        String entityId = null;

        try {
            Object[] args = joinPoint.getArgs();
            if (args != null && args.length > 0) {
                details.put("arguments", extractRelevantArguments(args));
            }

            Object result = joinPoint.proceed();
            entityId = extractEntityId(result);
            return result;
        } catch (Exception e) {
            status = AuditEventStatus.FAILURE;
            details.put("error", e.getMessage());
            details.put("errorType", e.getClass().getSimpleName());
            throw e;
        } finally {
            AuditEvent event = auditService.createEvent(
                    actor,
                    ipAddress,
                    auditable.action(),
                    entityId,
                    auditable.entityType(),
                    details,
                    status
            );
            auditService.logEvent(event);
        }
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes != null ? attributes.getRequest() : null;
    }

    private String resolveActor(HttpServletRequest request) {
        if (request == null) {
            return ANONYMOUS;
        }
        String actor = request.getHeader(ACTOR_HEADER);
        return actor != null && !actor.isBlank() ? actor.trim() : ANONYMOUS;
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return "UNKNOWN";
        }
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    // results are records (id()) or beans (getId())
    private String extractEntityId(Object result) {
        if (result == null) return null;
        for (String accessor : new String[]{"id", "getId", "datasetId"}) {
            try {
                Method method = result.getClass().getMethod(accessor);
                Object id = method.invoke(result);
                if (id != null) {
                    return id.toString();
                }
            } catch (NoSuchMethodException e) {
                // try the next accessor
            } catch (ReflectiveOperationException e) {
                log.debug("Could not read {} from {}", accessor, result.getClass().getSimpleName(), e);
                return null;
            }
        }
        return null;
    }

    private Map<String, Object> extractRelevantArguments(Object[] args) {
        Map<String, Object> relevant = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg == null) continue;

            if (arg instanceof String || arg instanceof Number || arg instanceof Boolean || arg instanceof Enum<?>) {
                relevant.put("arg" + i, arg.toString());
            } else {
                relevant.put("arg" + i + "_type", arg.getClass().getSimpleName());
            }
        }
        return relevant;
    }
}
