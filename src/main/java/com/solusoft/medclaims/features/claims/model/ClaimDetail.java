package com.solusoft.medclaims.features.claims.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.solusoft.medclaims.features.payments.model.Payment;
import com.solusoft.medclaims.features.reviews.model.ReviewView;

/**
 * A claim with everything it owns. {@code payments} is left out for callers that may not read payments.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimDetail(
    @JsonUnwrapped Claim claim,
    List<ClaimAttachment> attachments,
    List<ReviewView> reviews,
    List<Payment> payments
) {}
