package com.solusoft.medclaims.features.policies.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.employers.repository.EmployerRepository;
import com.solusoft.medclaims.features.policies.model.Policy;
import com.solusoft.medclaims.features.policies.model.PolicyPatch;
import com.solusoft.medclaims.features.policies.model.PolicyRequest;
import com.solusoft.medclaims.features.policies.repository.PolicyRepository;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;

public class PolicyServiceTest {

    private static final ClaimsPrincipal HR = new ClaimsPrincipal(30L, "hr@example.com", Role.HR);
    private static final ClaimsPrincipal HOLDER = new ClaimsPrincipal(42L, "holder@example.com", Role.POLICYHOLDER);

    @Mock
    private PolicyRepository policyRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private EmployerRepository employerRepository;

    @Mock
    private AuditTrail auditTrail;

    private PolicyService service;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        service = new PolicyService(policyRepository, userRepository, employerRepository, new AccessPolicy(), auditTrail);

        User holder = new User();
        holder.setId(42L);
        holder.setRole(Role.POLICYHOLDER);
        when(userRepository.findById(42L)).thenReturn(Optional.of(holder));
        User finance = new User();
        finance.setId(20L);
        finance.setRole(Role.FINANCE);
        when(userRepository.findById(20L)).thenReturn(Optional.of(finance));

        when(employerRepository.existsById(3L)).thenReturn(true);
        when(policyRepository.save(any(Policy.class))).thenAnswer(inv -> {
            Policy policy = inv.getArgument(0);
            if (policy.getId() == null) {
                policy.setId(5L);
            }
            return policy;
        });
    }

    private PolicyRequest request(Long holderId, Long employerId) {
        return new PolicyRequest(" Gold ", holderId, employerId, LocalDate.of(2026, 1, 1), LocalDate.of(2026, 12, 31), null);
    }

    private Policy existing() {
        Policy policy = new Policy();
        policy.setId(5L);
        policy.setMemberNumber("MEM-ABC1234");
        policy.setPolicyholderId(42L);
        policy.setStartDate(LocalDate.of(2026, 1, 1));
        policy.setEndDate(LocalDate.of(2026, 12, 31));
        when(policyRepository.findById(5L)).thenReturn(Optional.of(policy));
        return policy;
    }

    @Test
    public void testCreate_issuesActivePolicyWithMemberNumber() {
        Policy policy = service.create(HR, request(42L, 3L));

        assertTrue(policy.getMemberNumber().matches("MEM-[0-9A-F]{7}"));
        assertEquals("Gold", policy.getPlanType());
        assertTrue(policy.isActive());
        assertEquals(3L, policy.getEmployerId());
    }

    @Test
    public void testCreate_holderWithoutPolicyholderRole_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.create(HR, request(20L, null)));
        verify(policyRepository, never()).save(any(Policy.class));
    }

    @Test
    public void testCreate_unknownEmployer_isNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> service.create(HR, request(42L, 4L)));
    }

    @Test
    public void testCreate_endBeforeStart_isRejected() {
        PolicyRequest request = new PolicyRequest("Gold", 42L, null, LocalDate.of(2026, 6, 1), LocalDate.of(2026, 5, 31), true);

        assertThrows(IllegalArgumentException.class, () -> service.create(HR, request));
    }

    @Test
    public void testCreate_policyholder_isDenied() {
        assertThrows(PermissionDeniedException.class, () -> service.create(HOLDER, request(42L, null)));
    }

    @Test
    public void testList_policyholderIsForcedToOwnPolicies() {
        service.list(HOLDER, 77L, null, 0, 20);

        verify(policyRepository).findVisible(eq(42L), isNull(), anyInt(), anyLong());
    }

    @Test
    public void testGet_foreignPolicy_isDenied() {
        existing().setPolicyholderId(99L);

        assertThrows(PermissionDeniedException.class, () -> service.get(HOLDER, 5L));
    }

    @Test
    public void testPatch_deactivate() {
        existing();

        Policy policy = service.patch(HR, 5L, new PolicyPatch(null, null, null, null, null, false));

        assertFalse(policy.isActive());
    }

    @Test
    public void testPatch_endDateBeforeExistingStart_isRejected() {
        existing();

        assertThrows(IllegalArgumentException.class,
                () -> service.patch(HR, 5L, new PolicyPatch(null, null, null, null, LocalDate.of(2025, 12, 31), null)));
        verify(policyRepository, never()).save(any(Policy.class));
    }

    @Test
    public void testNextMemberNumber_retriesOnCollision() {
        when(policyRepository.existsByMemberNumber(any())).thenReturn(true, false);

        assertTrue(service.nextMemberNumber().startsWith("MEM-"));
    }
}
