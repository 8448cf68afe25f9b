package com.solusoft.medclaims.features.claims.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimStatusTotal;

public interface ClaimRepository extends ListCrudRepository<Claim, Long> {

    Optional<Claim> findByReferenceNumber(String referenceNumber);

    boolean existsByReferenceNumber(String referenceNumber);

    /**
     * Claims filtered by status; when {@code policyholderId} is given only claims on
     * policies held by that user are returned.
     */
    @Query("""
        SELECT c.* FROM claims c
        JOIN policies p ON p.id = c.policy_id
        WHERE (CAST(:status AS TEXT) IS NULL OR c.status = :status)
          AND (CAST(:policyholderId AS BIGINT) IS NULL OR p.policyholder_id = :policyholderId)
        ORDER BY c.submission_date DESC, c.id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Claim> findVisible(@Param("status") String status,
                            @Param("policyholderId") Long policyholderId,
                            @Param("limit") int limit,
                            @Param("offset") long offset);

    @Query(value = """
        SELECT c.status AS status, COUNT(*) AS claim_count, COALESCE(SUM(c.approved_amount), 0) AS approved_total
        FROM claims c
        JOIN policies p ON p.id = c.policy_id
        WHERE p.policyholder_id = :policyholderId
        GROUP BY c.status
    """, rowMapperClass = ClaimStatusTotalRowMapper.class)
    List<ClaimStatusTotal> summarizeByPolicyholder(@Param("policyholderId") Long policyholderId);
}
