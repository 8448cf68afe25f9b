package com.solusoft.medclaims.features.reviews.repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.reviews.model.ReviewItem;

public interface ReviewItemRepository extends ListCrudRepository<ReviewItem, Long> {

    List<ReviewItem> findByReviewId(Long reviewId);

    Optional<ReviewItem> findByIdAndReviewId(Long id, Long reviewId);

    /** Every item of every review recorded against the claim. */
    @Query("""
        SELECT ri.* FROM review_items ri
        JOIN reviews r ON r.id = ri.review_id
        WHERE r.claim_id = :claimId
    """)
    List<ReviewItem> findByClaimId(@Param("claimId") Long claimId);

    /** Sum of approved amounts over every item of every review of the claim; null counts as zero. */
    @Query("""
        SELECT COALESCE(SUM(ri.approved_amount), 0) FROM review_items ri
        JOIN reviews r ON r.id = ri.review_id
        WHERE r.claim_id = :claimId
    """)
    BigDecimal sumApprovedAmountByClaimId(@Param("claimId") Long claimId);
}
