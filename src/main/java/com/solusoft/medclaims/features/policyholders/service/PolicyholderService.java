package com.solusoft.medclaims.features.policyholders.service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.model.ClaimStatusTotal;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.notifications.repository.NotificationRepository;
import com.solusoft.medclaims.features.policies.repository.PolicyRepository;
import com.solusoft.medclaims.features.policyholders.model.DashboardSummary;
import com.solusoft.medclaims.features.users.model.ProfileUpdate;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.service.UserService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import lombok.extern.slf4j.Slf4j;

/**
 * Self-service views for policyholders. Everything here is scoped to the caller's own policies,
 * claims and inbox; other roles are turned away.
 */
@Service
@Slf4j
public class PolicyholderService {

    static final Set<ClaimStatus> PENDING = EnumSet.of(ClaimStatus.SUBMITTED, ClaimStatus.UNDER_REVIEW_CS,
            ClaimStatus.UNDER_REVIEW_CLAIMS, ClaimStatus.PENDING_MD_APPROVAL);
    static final Set<ClaimStatus> APPROVED = EnumSet.of(ClaimStatus.APPROVED, ClaimStatus.PARTIALLY_APPROVED,
            ClaimStatus.PENDING_PAYMENT, ClaimStatus.PAID);

    private final PolicyRepository policyRepository;
    private final ClaimRepository claimRepository;
    private final NotificationRepository notificationRepository;
    private final UserService userService;

    public PolicyholderService(PolicyRepository policyRepository, ClaimRepository claimRepository,
                               NotificationRepository notificationRepository, UserService userService) {
        this.policyRepository = policyRepository;
        this.claimRepository = claimRepository;
        this.notificationRepository = notificationRepository;
        this.userService = userService;
    }

    @Transactional(readOnly = true)
    public DashboardSummary dashboard(ClaimsPrincipal principal) {
        log.info("Entering dashboard for user {}", principal.userId());
        requirePolicyholder(principal);
        Long holderId = principal.userId();

        // 1. Fold the per-status totals into the dashboard buckets
        Map<ClaimStatus, Long> byStatus = new EnumMap<>(ClaimStatus.class);
        for (ClaimStatus status : ClaimStatus.values()) {
            byStatus.put(status, 0L);
        }
        long totalClaims = 0;
        long pending = 0;
        long approved = 0;
        BigDecimal approvedAmount = BigDecimal.ZERO;
        for (ClaimStatusTotal total : claimRepository.summarizeByPolicyholder(holderId)) {
            byStatus.put(total.status(), total.claimCount());
            totalClaims += total.claimCount();
            if (PENDING.contains(total.status())) {
                pending += total.claimCount();
            } else if (APPROVED.contains(total.status())) {
                approved += total.claimCount();
                approvedAmount = approvedAmount.add(total.approvedTotal());
            }
        }

        // 2. Policies and inbox are plain counts
        DashboardSummary summary = new DashboardSummary(
                policyRepository.countByPolicyholder(holderId),
                policyRepository.countActiveByPolicyholder(holderId),
                totalClaims,
                pending,
                approved,
                byStatus.get(ClaimStatus.REJECTED),
                approvedAmount,
                notificationRepository.countUnread(holderId),
                byStatus);
        log.debug("Dashboard for user {}: {} claims, {} pending", holderId, totalClaims, pending);
        return summary;
    }

    @Transactional(readOnly = true)
    public User profile(ClaimsPrincipal principal) {
        requirePolicyholder(principal);
        return userService.me(principal);
    }

    @Transactional
    public User updateProfile(ClaimsPrincipal principal, ProfileUpdate update) {
        requirePolicyholder(principal);
        return userService.updateProfile(principal, update);
    }

    private static void requirePolicyholder(ClaimsPrincipal principal) {
        if (!principal.is(Role.POLICYHOLDER)) {
            throw new PermissionDeniedException("Policyholder role required");
        }
    }
}
