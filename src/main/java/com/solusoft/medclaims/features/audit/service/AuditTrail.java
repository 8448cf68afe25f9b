package com.solusoft.medclaims.features.audit.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.model.AuditEvent;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Entry point for services to record an audited action. The entry is only written if the
 * surrounding transaction commits.
 */
@Component
public class AuditTrail {

    private final ApplicationEventPublisher publisher;

    public AuditTrail(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void record(ClaimsPrincipal actor, AuditAction action, String entityType, Long entityId,
                       Map<String, Object> details) {
        publisher.publishEvent(new AuditEvent(
                actor == null ? null : actor.userId(),
                action,
                entityType,
                entityId,
                details == null ? Map.of() : details,
                currentClientAddress()));
    }

    public void record(ClaimsPrincipal actor, AuditAction action, String entityType, Long entityId) {
        record(actor, action, entityType, entityId, Map.of());
    }

    /** Builds a details map from alternating keys and values; values are stored as strings. */
    public static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            map.put(String.valueOf(keyValues[i]), value == null ? null : String.valueOf(value));
        }
        return map;
    }

    static String currentClientAddress() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return null;
        }
        HttpServletRequest request = servletAttributes.getRequest();
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
