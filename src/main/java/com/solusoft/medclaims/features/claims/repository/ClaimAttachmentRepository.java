package com.solusoft.medclaims.features.claims.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.repository.ListCrudRepository;

import com.solusoft.medclaims.features.claims.model.ClaimAttachment;

public interface ClaimAttachmentRepository extends ListCrudRepository<ClaimAttachment, Long> {

    List<ClaimAttachment> findByClaimId(Long claimId);

    Optional<ClaimAttachment> findByIdAndClaimId(Long id, Long claimId);
}
