package com.solusoft.medclaims.events;

import com.solusoft.medclaims.features.claims.model.ClaimStatus;

public record ClaimStatusChangedEvent(
    Long claimId,
    String referenceNumber,
    Long policyholderId,
    ClaimStatus previousStatus,
    ClaimStatus newStatus
) {}
