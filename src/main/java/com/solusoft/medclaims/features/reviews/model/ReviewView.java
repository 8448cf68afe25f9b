package com.solusoft.medclaims.features.reviews.model;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A review together with its line items and the reviewer's display name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewView(
    Long id,
    Long claimId,
    Long reviewerId,
    String reviewerName,
    ReviewType reviewType,
    ReviewDecision decision,
    String comments,
    String rejectionReason,
    Instant reviewedAt,
    List<ReviewItem> items
) {}
