package com.solusoft.medclaims.features.audit.model;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    APPROVE,
    REJECT,
    PAYMENT,
    STATUS_CHANGE
}
