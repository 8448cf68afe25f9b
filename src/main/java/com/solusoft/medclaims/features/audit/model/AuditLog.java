package com.solusoft.medclaims.features.audit.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("audit_logs")
@Getter
@Setter
@NoArgsConstructor
public class AuditLog {

    @Id
    private Long id;

    private Long userId;
    private AuditAction action;
    private String entityType;
    private Long entityId;
    @JsonIgnore
    private AuditDetails details;
    private String ipAddress;
    private Instant createdAt;

    @JsonRawValue
    public String getDetailsJson() {
        return details == null ? null : details.json();
    }
}
