package com.solusoft.medclaims.features.reviews.model;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ReviewItemRequest(
    @NotBlank String itemName,
    @NotNull @DecimalMin(value = "0.00") BigDecimal requestedAmount,
    @DecimalMin(value = "0.00") BigDecimal approvedAmount,
    @NotNull ReviewItemStatus status,
    String rejectionReason
) {}
