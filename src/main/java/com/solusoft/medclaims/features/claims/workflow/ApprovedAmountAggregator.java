package com.solusoft.medclaims.features.claims.workflow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.reviews.repository.ReviewItemRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps {@code claims.approved_amount} equal to the sum of the approved amounts of all
 * review items recorded against the claim. Always a full re-sum, never an increment.
 */
@Component
@Slf4j
public class ApprovedAmountAggregator {

    private final ReviewItemRepository reviewItemRepository;
    private final ClaimRepository claimRepository;

    public ApprovedAmountAggregator(ReviewItemRepository reviewItemRepository, ClaimRepository claimRepository) {
        this.reviewItemRepository = reviewItemRepository;
        this.claimRepository = claimRepository;
    }

    /**
     * Must run in the caller's transaction, right after the item write.
     *
     * @throws InconsistentStateException if the total would exceed the claim's requested amount
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal recalculate(Long claimId) {
        Claim claim = claimRepository.findById(claimId)
                .orElseThrow(() -> ResourceNotFoundException.of("Claim", claimId));

        BigDecimal total = reviewItemRepository.sumApprovedAmountByClaimId(claimId);
        if (total == null) {
            total = BigDecimal.ZERO;
        }
        total = total.setScale(2, RoundingMode.HALF_UP);

        if (claim.getRequestedAmount() != null && total.compareTo(claim.getRequestedAmount()) > 0) {
            throw new InconsistentStateException("Approved total " + total + " exceeds the requested amount "
                    + claim.getRequestedAmount() + " of claim " + claim.getReferenceNumber());
        }

        claim.setApprovedAmount(total);
        claim.setUpdatedAt(Instant.now());
        claimRepository.save(claim);

        log.debug("Claim {} approved amount recalculated to {}", claimId, total);
        return total;
    }
}
