package com.solusoft.medclaims.features.audit.model;

/**
 * Serialized JSON payload of an audit entry, stored in a JSONB column.
 */
public record AuditDetails(String json) {

    public static AuditDetails empty() {
        return new AuditDetails("{}");
    }
}
