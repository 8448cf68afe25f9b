package com.solusoft.medclaims.features.audit.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.model.AuditEvent;
import com.solusoft.medclaims.features.audit.model.AuditLog;
import com.solusoft.medclaims.features.audit.repository.AuditLogRepository;

public class AuditRecorderTest {

    @Mock
    private AuditLogRepository repository;

    private AuditRecorder recorder;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        recorder = new AuditRecorder(repository, new ObjectMapper());
    }

    @Test
    public void testOnAuditEvent_persistsEntryWithJsonDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("old_status", "SUBMITTED");
        details.put("new_status", "UNDER_REVIEW_CLAIMS");

        recorder.onAuditEvent(new AuditEvent(10L, AuditAction.STATUS_CHANGE, "Claim", 1L, details, "10.0.0.5"));

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(repository).save(saved.capture());
        AuditLog entry = saved.getValue();
        assertEquals(10L, entry.getUserId());
        assertEquals(AuditAction.STATUS_CHANGE, entry.getAction());
        assertEquals("Claim", entry.getEntityType());
        assertEquals(1L, entry.getEntityId());
        assertEquals("10.0.0.5", entry.getIpAddress());
        assertEquals("{\"old_status\":\"SUBMITTED\",\"new_status\":\"UNDER_REVIEW_CLAIMS\"}", entry.getDetailsJson());
        assertNotNull(entry.getCreatedAt());
    }

    @Test
    public void testOnAuditEvent_noDetails_storesEmptyObject() {
        recorder.onAuditEvent(new AuditEvent(1L, AuditAction.DELETE, "Employer", 3L, Map.of(), null));

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(repository).save(saved.capture());
        assertEquals("{}", saved.getValue().getDetailsJson());
    }

    @Test
    public void testOnAuditEvent_repositoryFailure_isSwallowed() {
        when(repository.save(any(AuditLog.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> recorder.onAuditEvent(
                new AuditEvent(1L, AuditAction.CREATE, "Claim", 1L, Map.of("reference_number", "CLM-1"), null)));
    }
}
