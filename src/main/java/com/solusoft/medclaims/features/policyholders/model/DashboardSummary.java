package com.solusoft.medclaims.features.policyholders.model;

import java.math.BigDecimal;
import java.util.Map;

import com.solusoft.medclaims.features.claims.model.ClaimStatus;

/**
 * What a policyholder sees on landing: their policies, how their claims are doing and how much
 * has been approved for them so far.
 */
public record DashboardSummary(
    long totalPolicies,
    long activePolicies,
    long totalClaims,
    long pendingClaims,
    long approvedClaims,
    long rejectedClaims,
    BigDecimal totalApprovedAmount,
    long unreadNotifications,
    Map<ClaimStatus, Long> byStatus
) {}
