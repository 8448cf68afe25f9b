package com.solusoft.medclaims.features.reviews.model;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;

public record ReviewItemPatch(
    String itemName,
    @DecimalMin(value = "0.00") BigDecimal requestedAmount,
    @DecimalMin(value = "0.00") BigDecimal approvedAmount,
    ReviewItemStatus status,
    String rejectionReason
) {}
