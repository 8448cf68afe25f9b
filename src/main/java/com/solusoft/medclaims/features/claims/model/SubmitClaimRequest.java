package com.solusoft.medclaims.features.claims.model;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SubmitClaimRequest(
    @NotNull Long policyId,
    @NotBlank String hospitalPharmacy,
    @NotBlank String reason,
    @NotNull @DecimalMin(value = "0.01") BigDecimal requestedAmount
) {}
