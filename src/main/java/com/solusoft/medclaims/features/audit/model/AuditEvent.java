package com.solusoft.medclaims.features.audit.model;

import java.util.Map;

/**
 * Published by services inside their transaction; persisted once the transaction commits.
 */
public record AuditEvent(
    Long actorId,
    AuditAction action,
    String entityType,
    Long entityId,
    Map<String, Object> details,
    String ipAddress
) {}
