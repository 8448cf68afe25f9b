package com.solusoft.medclaims.features.reviews.model;

public enum ReviewDecision {
    APPROVED,
    PARTIALLY_APPROVED,
    REJECTED,
    NEEDS_MORE_INFO
}
