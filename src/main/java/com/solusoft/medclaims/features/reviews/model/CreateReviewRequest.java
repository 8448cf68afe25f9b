package com.solusoft.medclaims.features.reviews.model;

import jakarta.validation.constraints.NotNull;

public record CreateReviewRequest(
    @NotNull ReviewType reviewType,
    @NotNull ReviewDecision decision,
    String comments,
    String rejectionReason
) {}
