package com.solusoft.medclaims.features.claims.workflow;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.InvalidDecisionException;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.reviews.model.ReviewDecision;
import com.solusoft.medclaims.features.reviews.model.ReviewType;

/**
 * The claim lifecycle as a pure function of (current status, event). Nothing here touches
 * storage; callers persist the returned status.
 *
 * <pre>
 * CUSTOMER_SERVICE  APPROVED | PARTIALLY_APPROVED  -> UNDER_REVIEW_CLAIMS
 * CLAIMS            APPROVED | PARTIALLY_APPROVED  -> PENDING_MD_APPROVAL
 * MD                APPROVED                       -> APPROVED
 * MD                PARTIALLY_APPROVED             -> PARTIALLY_APPROVED
 * any               REJECTED                       -> REJECTED
 * payment created                                  -> PENDING_PAYMENT
 * payment processed                                -> PAID
 * </pre>
 */
@Component
public class ClaimStatusTransitions {

    private static final Map<ReviewType, Set<ClaimStatus>> PRECONDITIONS = new EnumMap<>(ReviewType.class);

    static {
        PRECONDITIONS.put(ReviewType.CUSTOMER_SERVICE, EnumSet.of(ClaimStatus.SUBMITTED, ClaimStatus.UNDER_REVIEW_CS));
        PRECONDITIONS.put(ReviewType.CLAIMS, EnumSet.of(ClaimStatus.UNDER_REVIEW_CLAIMS));
        PRECONDITIONS.put(ReviewType.MD, EnumSet.of(ClaimStatus.PENDING_MD_APPROVAL));
    }

    /**
     * Status a claim lands in when a review of the given type records the given decision,
     * ignoring where the claim currently is.
     *
     * @throws InvalidDecisionException for NEEDS_MORE_INFO or any other pair outside the table
     */
    public ClaimStatus outcome(ReviewType reviewType, ReviewDecision decision) {
        if (reviewType == null || decision == null) {
            throw new InvalidDecisionException("Review type and decision are required");
        }
        if (decision == ReviewDecision.REJECTED) {
            return ClaimStatus.REJECTED;
        }
        if (decision == ReviewDecision.NEEDS_MORE_INFO) {
            throw new InvalidDecisionException("Decision NEEDS_MORE_INFO has no status transition for a "
                    + reviewType + " review");
        }
        switch (reviewType) {
            case CUSTOMER_SERVICE:
                return ClaimStatus.UNDER_REVIEW_CLAIMS;
            case CLAIMS:
                return ClaimStatus.PENDING_MD_APPROVAL;
            case MD:
                return decision == ReviewDecision.APPROVED ? ClaimStatus.APPROVED : ClaimStatus.PARTIALLY_APPROVED;
            default:
                throw new InvalidDecisionException("Unsupported review type: " + reviewType);
        }
    }

    /**
     * Next status for a new review recorded against a claim in {@code current}.
     *
     * @throws InvalidDecisionException when the claim is not at the stage this review type acts on,
     *         or the decision has no transition
     */
    public ClaimStatus next(ClaimStatus current, ReviewType reviewType, ReviewDecision decision) {
        if (reviewType != null && !PRECONDITIONS.get(reviewType).contains(current)) {
            throw new InvalidDecisionException("A " + reviewType + " review cannot be recorded while the claim is "
                    + current);
        }
        return outcome(reviewType, decision);
    }

    /**
     * Re-applies the table when the decision of an already recorded review is changed. The claim
     * must still sit in the status the old decision produced, so later stages are never undone.
     * A terminal claim (REJECTED, PAID) never leaves its status this way.
     */
    public ClaimStatus reviseDecision(ClaimStatus current, ReviewType reviewType,
                                      ReviewDecision previousDecision, ReviewDecision newDecision) {
        if (current == null || current.isTerminal()) {
            throw new InconsistentStateException("Claim is " + current + "; the " + reviewType
                    + " decision can no longer be changed");
        }
        ClaimStatus produced = outcome(reviewType, previousDecision);
        if (current != produced) {
            throw new InconsistentStateException("Claim has moved on to " + current
                    + "; the " + reviewType + " decision can no longer be changed");
        }
        return outcome(reviewType, newDecision);
    }

    public ClaimStatus afterPaymentScheduled(ClaimStatus current) {
        if (current == null || !current.isPayable()) {
            throw new InconsistentStateException("Payment can only be created for an APPROVED or "
                    + "PARTIALLY_APPROVED claim, claim is " + current);
        }
        return ClaimStatus.PENDING_PAYMENT;
    }

    public ClaimStatus afterPaymentProcessed(ClaimStatus current) {
        return ClaimStatus.PAID;
    }
}
