package com.sldce.backend.services;

import com.sldce.backend.entities.AuditEvent;
import com.sldce.backend.enums.AuditEventStatus;
import com.sldce.backend.repositories.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditEventRepository auditEventRepository;

    /**
     * Runs in its own transaction so an audit row survives the rollback of the audited operation.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(AuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.error("Failed to store audit event {} for {}", event.getAction(), event.getEntityType(), e);
        }
    }

    public AuditEvent createEvent(
            String actor,
            String ipAddress,
            String action,
            String entityId,
            String entityType,
            Map<String, Object> details,
            AuditEventStatus status
    ) {
        return AuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .actor(actor)
                .ipAddress(ipAddress)
                .action(action)
                .entityId(entityId)
                .entityType(entityType)
                .details(details)
                .status(status)
                .build();
    }
}
