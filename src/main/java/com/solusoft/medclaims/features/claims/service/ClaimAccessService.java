package com.solusoft.medclaims.features.claims.service;

import org.springframework.stereotype.Service;

import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.policies.model.Policy;
import com.solusoft.medclaims.features.policies.repository.PolicyRepository;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.security.ClaimsPrincipal;

/**
 * Record-level scoping for policyholders: a claim belongs to the holder of its policy, and
 * reviews, payments and attachments belong to whoever owns their claim.
 */
@Service
public class ClaimAccessService {

    private final ClaimRepository claimRepository;
    private final PolicyRepository policyRepository;

    public ClaimAccessService(ClaimRepository claimRepository, PolicyRepository policyRepository) {
        this.claimRepository = claimRepository;
        this.policyRepository = policyRepository;
    }

    public Claim loadClaim(Long claimId) {
        return claimRepository.findById(claimId)
                .orElseThrow(() -> ResourceNotFoundException.of("Claim", claimId));
    }

    /** Loads the claim and verifies the caller may see it. */
    public Claim loadAccessibleClaim(ClaimsPrincipal principal, Long claimId) {
        Claim claim = loadClaim(claimId);
        requireAccess(principal, claim);
        return claim;
    }

    public void requireAccess(ClaimsPrincipal principal, Claim claim) {
        if (!principal.is(Role.POLICYHOLDER)) {
            return;
        }
        Long holder = policyholderOf(claim);
        if (holder == null || !holder.equals(principal.userId())) {
            throw new PermissionDeniedException("Claim " + claim.getReferenceNumber() + " does not belong to the caller");
        }
    }

    /** Owner filter for listing queries; null means unrestricted. */
    public Long ownerScope(ClaimsPrincipal principal) {
        return principal.is(Role.POLICYHOLDER) ? principal.userId() : null;
    }

    public Long policyholderOf(Claim claim) {
        return policyRepository.findById(claim.getPolicyId())
                .map(Policy::getPolicyholderId)
                .orElse(null);
    }
}
