package com.solusoft.medclaims.features.claims.model;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;

// null fields are left untouched; status and amounts decided by reviewers are not patchable
public record ClaimPatch(
    String hospitalPharmacy,
    String reason,
    @DecimalMin(value = "0.01") BigDecimal requestedAmount
) {}
