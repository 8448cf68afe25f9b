package com.solusoft.medclaims.features.audit.service;

import java.time.Instant;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.medclaims.config.AsyncConfig;
import com.solusoft.medclaims.features.audit.model.AuditDetails;
import com.solusoft.medclaims.features.audit.model.AuditEvent;
import com.solusoft.medclaims.features.audit.model.AuditLog;
import com.solusoft.medclaims.features.audit.repository.AuditLogRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Appends committed {@link AuditEvent}s to {@code audit_logs}.
 */
@Component
@Slf4j
public class AuditRecorder {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;

    public AuditRecorder(AuditLogRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAuditEvent(AuditEvent event) {
        try {
            AuditLog entry = new AuditLog();
            entry.setUserId(event.actorId());
            entry.setAction(event.action());
            entry.setEntityType(event.entityType());
            entry.setEntityId(event.entityId());
            entry.setDetails(toDetails(event));
            entry.setIpAddress(event.ipAddress());
            entry.setCreatedAt(Instant.now());
            repository.save(entry);
            log.debug("Audit {} {}#{} by user {}", event.action(), event.entityType(), event.entityId(), event.actorId());
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry {} {}#{}", event.action(), event.entityType(), event.entityId(), e);
        }
    }

    AuditDetails toDetails(AuditEvent event) {
        if (event.details() == null || event.details().isEmpty()) {
            return AuditDetails.empty();
        }
        try {
            return new AuditDetails(objectMapper.writeValueAsString(event.details()));
        } catch (JsonProcessingException e) {
            log.warn("Audit details of {} {}#{} not serializable: {}", event.action(), event.entityType(),
                    event.entityId(), e.getMessage());
            return AuditDetails.empty();
        }
    }
}
