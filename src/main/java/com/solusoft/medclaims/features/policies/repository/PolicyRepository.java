package com.solusoft.medclaims.features.policies.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.policies.model.Policy;

public interface PolicyRepository extends ListCrudRepository<Policy, Long> {

    Optional<Policy> findByMemberNumber(String memberNumber);

    boolean existsByMemberNumber(String memberNumber);

    @Query("""
        SELECT * FROM policies
        WHERE (CAST(:policyholderId AS BIGINT) IS NULL OR policyholder_id = :policyholderId)
          AND (CAST(:employerId AS BIGINT) IS NULL OR employer_id = :employerId)
        ORDER BY id
        LIMIT :limit OFFSET :offset
    """)
    List<Policy> findVisible(@Param("policyholderId") Long policyholderId,
                             @Param("employerId") Long employerId,
                             @Param("limit") int limit,
                             @Param("offset") long offset);

    @Query("SELECT COUNT(*) FROM policies WHERE policyholder_id = :policyholderId")
    long countByPolicyholder(@Param("policyholderId") Long policyholderId);

    @Query("SELECT COUNT(*) FROM policies WHERE policyholder_id = :policyholderId AND active = true")
    long countActiveByPolicyholder(@Param("policyholderId") Long policyholderId);
}
