package com.solusoft.medclaims.features.audit.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.model.AuditEvent;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.security.ClaimsPrincipal;

public class AuditTrailTest {

    @Mock
    private ApplicationEventPublisher publisher;

    private AuditTrail auditTrail;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        auditTrail = new AuditTrail(publisher);
    }

    @AfterEach
    public void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    public void testDetails_keepsOrderAndStringifiesValues() {
        Map<String, Object> details = AuditTrail.details("old_status", ClaimStatus.SUBMITTED,
                "amount", new BigDecimal("500.00"), "note", null);

        assertEquals(List.of("old_status", "amount", "note"), List.copyOf(details.keySet()));
        assertEquals("SUBMITTED", details.get("old_status"));
        assertEquals("500.00", details.get("amount"));
        assertNull(details.get("note"));
    }

    @Test
    public void testRecord_usesForwardedClientAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        auditTrail.record(new ClaimsPrincipal(5L, "a@example.com", Role.ADMIN), AuditAction.UPDATE, "Policy", 9L);

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertEquals("203.0.113.7", event.getValue().ipAddress());
        assertEquals(5L, event.getValue().actorId());
        assertTrue(event.getValue().details().isEmpty());
    }

    @Test
    public void testRecord_outsideRequest_hasNoAddress() {
        auditTrail.record(null, AuditAction.CREATE, "Claim", 1L, null);

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertNull(event.getValue().ipAddress());
        assertNull(event.getValue().actorId());
    }
}
