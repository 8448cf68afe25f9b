package com.solusoft.medclaims.features.policies.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
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
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class PolicyService {

    private final PolicyRepository policyRepository;
    private final UserRepository userRepository;
    private final EmployerRepository employerRepository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;

    public PolicyService(PolicyRepository policyRepository,
                         UserRepository userRepository,
                         EmployerRepository employerRepository,
                         AccessPolicy accessPolicy,
                         AuditTrail auditTrail) {
        this.policyRepository = policyRepository;
        this.userRepository = userRepository;
        this.employerRepository = employerRepository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public Policy create(ClaimsPrincipal principal, PolicyRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_POLICIES);
        requirePolicyholder(request.policyholderId());
        requireEmployer(request.employerId());
        requireValidPeriod(request.startDate(), request.endDate());

        Instant now = Instant.now();
        Policy policy = new Policy();
        policy.setMemberNumber(nextMemberNumber());
        policy.setPlanType(request.planType().trim());
        policy.setPolicyholderId(request.policyholderId());
        policy.setEmployerId(request.employerId());
        policy.setStartDate(request.startDate());
        policy.setEndDate(request.endDate());
        policy.setActive(request.active() == null || request.active());
        policy.setCreatedAt(now);
        policy.setUpdatedAt(now);
        policy = policyRepository.save(policy);

        auditTrail.record(principal, AuditAction.CREATE, "Policy", policy.getId(),
                details("member_number", policy.getMemberNumber(), "policyholder_id", policy.getPolicyholderId()));
        log.info("Policy {} issued to user {}", policy.getMemberNumber(), policy.getPolicyholderId());
        return policy;
    }

    /** Policyholders only ever see their own policies. */
    @Transactional(readOnly = true)
    public List<Policy> list(ClaimsPrincipal principal, Long policyholderId, Long employerId, int page, int size) {
        accessPolicy.require(principal, Operation.READ_POLICIES);
        Long holderFilter = principal.is(Role.POLICYHOLDER) ? principal.userId() : policyholderId;
        return policyRepository.findVisible(holderFilter, employerId, Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional(readOnly = true)
    public Policy get(ClaimsPrincipal principal, Long policyId) {
        accessPolicy.require(principal, Operation.READ_POLICIES);
        Policy policy = load(policyId);
        if (principal.is(Role.POLICYHOLDER) && !principal.userId().equals(policy.getPolicyholderId())) {
            throw new PermissionDeniedException("Policy " + policy.getMemberNumber() + " does not belong to the caller");
        }
        return policy;
    }

    @Transactional
    public Policy patch(ClaimsPrincipal principal, Long policyId, PolicyPatch patch) {
        accessPolicy.require(principal, Operation.MANAGE_POLICIES);
        Policy policy = load(policyId);

        if (patch.planType() != null && !patch.planType().isBlank()) {
            policy.setPlanType(patch.planType().trim());
        }
        if (patch.policyholderId() != null) {
            requirePolicyholder(patch.policyholderId());
            policy.setPolicyholderId(patch.policyholderId());
        }
        if (patch.employerId() != null) {
            requireEmployer(patch.employerId());
            policy.setEmployerId(patch.employerId());
        }
        if (patch.startDate() != null) {
            policy.setStartDate(patch.startDate());
        }
        if (patch.endDate() != null) {
            policy.setEndDate(patch.endDate());
        }
        if (patch.active() != null) {
            policy.setActive(patch.active());
        }
        requireValidPeriod(policy.getStartDate(), policy.getEndDate());
        policy.setUpdatedAt(Instant.now());
        policy = policyRepository.save(policy);

        auditTrail.record(principal, AuditAction.UPDATE, "Policy", policyId,
                details("member_number", policy.getMemberNumber(), "active", policy.isActive()));
        return policy;
    }

    @Transactional
    public void delete(ClaimsPrincipal principal, Long policyId) {
        accessPolicy.require(principal, Operation.MANAGE_POLICIES);
        Policy policy = load(policyId);
        policyRepository.delete(policy);
        auditTrail.record(principal, AuditAction.DELETE, "Policy", policyId,
                details("member_number", policy.getMemberNumber()));
    }

    private Policy load(Long policyId) {
        return policyRepository.findById(policyId)
                .orElseThrow(() -> ResourceNotFoundException.of("Policy", policyId));
    }

    private void requirePolicyholder(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        if (user.getRole() != Role.POLICYHOLDER) {
            throw new IllegalArgumentException("User " + userId + " is not a policyholder");
        }
    }

    private void requireEmployer(Long employerId) {
        if (employerId != null && !employerRepository.existsById(employerId)) {
            throw ResourceNotFoundException.of("Employer", employerId);
        }
    }

    private static void requireValidPeriod(LocalDate start, LocalDate end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Policy end date " + end + " is before its start date " + start);
        }
    }

    String nextMemberNumber() {
        String candidate;
        do {
            // 7 hex characters out of a 28 bit random value
            int value = ThreadLocalRandom.current().nextInt(1 << 28);
            candidate = "MEM-" + HexFormat.of().withUpperCase().toHexDigits(value).substring(1);
        } while (policyRepository.existsByMemberNumber(candidate));
        return candidate;
    }
}
