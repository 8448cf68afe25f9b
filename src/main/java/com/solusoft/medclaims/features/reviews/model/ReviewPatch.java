package com.solusoft.medclaims.features.reviews.model;

// reviewer and review type are fixed once recorded
public record ReviewPatch(
    String comments,
    ReviewDecision decision,
    String rejectionReason
) {}
