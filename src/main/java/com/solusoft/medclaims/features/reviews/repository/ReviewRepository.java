package com.solusoft.medclaims.features.reviews.repository;

import java.util.List;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.reviews.model.Review;

public interface ReviewRepository extends ListCrudRepository<Review, Long> {

    List<Review> findByClaimId(Long claimId);

    @Query("""
        SELECT r.* FROM reviews r
        JOIN claims c ON c.id = r.claim_id
        JOIN policies p ON p.id = c.policy_id
        WHERE (CAST(:claimId AS BIGINT) IS NULL OR r.claim_id = :claimId)
          AND (CAST(:reviewType AS TEXT) IS NULL OR r.review_type = :reviewType)
          AND (CAST(:policyholderId AS BIGINT) IS NULL OR p.policyholder_id = :policyholderId)
        ORDER BY r.reviewed_at DESC, r.id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Review> findVisible(@Param("claimId") Long claimId,
                             @Param("reviewType") String reviewType,
                             @Param("policyholderId") Long policyholderId,
                             @Param("limit") int limit,
                             @Param("offset") long offset);
}
