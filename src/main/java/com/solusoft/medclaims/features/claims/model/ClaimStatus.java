package com.solusoft.medclaims.features.claims.model;

import java.util.Arrays;

import com.solusoft.medclaims.exception.InvalidDecisionException;

public enum ClaimStatus {
    SUBMITTED("submitted"),
    UNDER_REVIEW_CS("under review by Customer Service"),
    UNDER_REVIEW_CLAIMS("under review by Claims Department"),
    PENDING_MD_APPROVAL("pending Medical Director approval"),
    APPROVED("approved"),
    PARTIALLY_APPROVED("partially approved"),
    REJECTED("rejected"),
    PENDING_PAYMENT("pending payment"),
    PAID("paid");

    private final String description;

    ClaimStatus(String description) {
        this.description = description;
    }

    /** Wording used in policyholder notifications. */
    public String description() {
        return description;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == PAID;
    }

    public boolean isPayable() {
        return this == APPROVED || this == PARTIALLY_APPROVED;
    }

    public static ClaimStatus parse(String value) {
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidDecisionException("Invalid claim status: " + value));
    }
}
