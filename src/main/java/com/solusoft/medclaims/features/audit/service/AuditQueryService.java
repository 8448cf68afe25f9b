package com.solusoft.medclaims.features.audit.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.features.audit.model.AuditLog;
import com.solusoft.medclaims.features.audit.repository.AuditLogRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

@Service
public class AuditQueryService {

    private final AuditLogRepository repository;
    private final AccessPolicy accessPolicy;

    public AuditQueryService(AuditLogRepository repository, AccessPolicy accessPolicy) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
    }

    @Transactional(readOnly = true)
    public List<AuditLog> search(ClaimsPrincipal principal, String entityType, Long entityId, Long userId,
                                 int page, int size) {
        accessPolicy.require(principal, Operation.READ_AUDIT);
        String typeFilter = (entityType == null || entityType.isBlank()) ? null : entityType;
        return repository.search(typeFilter, entityId, userId, Paging.limit(size), Paging.offset(page, size));
    }
}
