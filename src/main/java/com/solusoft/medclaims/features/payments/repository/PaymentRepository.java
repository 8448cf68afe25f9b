package com.solusoft.medclaims.features.payments.repository;

import java.util.List;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.payments.model.Payment;

public interface PaymentRepository extends ListCrudRepository<Payment, Long> {

    List<Payment> findByClaimId(Long claimId);

    @Query("""
        SELECT pm.* FROM payments pm
        JOIN claims c ON c.id = pm.claim_id
        JOIN policies p ON p.id = c.policy_id
        WHERE (CAST(:claimId AS BIGINT) IS NULL OR pm.claim_id = :claimId)
          AND (CAST(:status AS TEXT) IS NULL OR pm.payment_status = :status)
          AND (CAST(:policyholderId AS BIGINT) IS NULL OR p.policyholder_id = :policyholderId)
        ORDER BY pm.payment_date DESC, pm.id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Payment> findVisible(@Param("claimId") Long claimId,
                              @Param("status") String status,
                              @Param("policyholderId") Long policyholderId,
                              @Param("limit") int limit,
                              @Param("offset") long offset);
}
