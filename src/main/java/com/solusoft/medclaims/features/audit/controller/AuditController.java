package com.solusoft.medclaims.features.audit.controller;

import java.util.List;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.features.audit.model.AuditLog;
import com.solusoft.medclaims.features.audit.service.AuditQueryService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditQueryService auditQueryService;

    public AuditController(AuditQueryService auditQueryService) {
        this.auditQueryService = auditQueryService;
    }

    @GetMapping
    public List<AuditLog> search(@AuthenticationPrincipal ClaimsPrincipal principal,
                                 @RequestParam(required = false) String entityType,
                                 @RequestParam(required = false) Long entityId,
                                 @RequestParam(required = false) Long userId,
                                 @RequestParam(defaultValue = "0") int page,
                                 @RequestParam(defaultValue = "20") int size) {
        return auditQueryService.search(principal, entityType, entityId, userId, page, size);
    }
}
