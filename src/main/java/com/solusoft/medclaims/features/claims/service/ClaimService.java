package com.solusoft.medclaims.features.claims.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.events.ClaimSubmittedEvent;
import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimAttachment;
import com.solusoft.medclaims.features.claims.model.ClaimDetail;
import com.solusoft.medclaims.features.claims.model.ClaimPatch;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.model.SubmitClaimRequest;
import com.solusoft.medclaims.features.claims.repository.ClaimAttachmentRepository;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.claims.storage.AttachmentStorage;
import com.solusoft.medclaims.features.claims.storage.StoredFile;
import com.solusoft.medclaims.features.payments.model.Payment;
import com.solusoft.medclaims.features.payments.repository.PaymentRepository;
import com.solusoft.medclaims.features.policies.model.Policy;
import com.solusoft.medclaims.features.policies.repository.PolicyRepository;
import com.solusoft.medclaims.features.reviews.service.ReviewService;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ClaimService {

    private final ClaimRepository claimRepository;
    private final ClaimAttachmentRepository attachmentRepository;
    private final PolicyRepository policyRepository;
    private final PaymentRepository paymentRepository;
    private final ReviewService reviewService;
    private final ClaimAccessService claimAccess;
    private final AttachmentStorage storage;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher events;
    private final AuditTrail auditTrail;

    public ClaimService(ClaimRepository claimRepository,
                        ClaimAttachmentRepository attachmentRepository,
                        PolicyRepository policyRepository,
                        PaymentRepository paymentRepository,
                        ReviewService reviewService,
                        ClaimAccessService claimAccess,
                        AttachmentStorage storage,
                        AccessPolicy accessPolicy,
                        ApplicationEventPublisher events,
                        AuditTrail auditTrail) {
        this.claimRepository = claimRepository;
        this.attachmentRepository = attachmentRepository;
        this.policyRepository = policyRepository;
        this.paymentRepository = paymentRepository;
        this.reviewService = reviewService;
        this.claimAccess = claimAccess;
        this.storage = storage;
        this.accessPolicy = accessPolicy;
        this.events = events;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public Claim submit(ClaimsPrincipal principal, SubmitClaimRequest request, List<MultipartFile> attachments) {
        log.info("Entering submit");
        log.debug("Input policyId: {}, requestedAmount: {}", request.policyId(), request.requestedAmount());
        accessPolicy.require(principal, Operation.SUBMIT_CLAIM);

        // 1. Policy must exist, be active and (for a policyholder) be their own
        Policy policy = policyRepository.findById(request.policyId())
                .orElseThrow(() -> ResourceNotFoundException.of("Policy", request.policyId()));
        if (!policy.isActive()) {
            throw new InconsistentStateException("Policy " + policy.getMemberNumber() + " is not active");
        }
        if (principal.is(Role.POLICYHOLDER) && !principal.userId().equals(policy.getPolicyholderId())) {
            throw new PermissionDeniedException("Policy " + policy.getMemberNumber() + " does not belong to the caller");
        }

        // 2. Persist the claim
        Instant now = Instant.now();
        Claim claim = new Claim();
        claim.setReferenceNumber(nextReferenceNumber());
        claim.setPolicyId(policy.getId());
        claim.setHospitalPharmacy(request.hospitalPharmacy().trim());
        claim.setReason(request.reason().trim());
        claim.setRequestedAmount(request.requestedAmount());
        claim.setStatus(ClaimStatus.SUBMITTED);
        claim.setSubmissionDate(now);
        claim.setCreatedAt(now);
        claim.setUpdatedAt(now);
        claim = claimRepository.save(claim);

        // 3. Store any documents sent along
        if (attachments != null) {
            for (MultipartFile file : attachments) {
                if (file != null && !file.isEmpty()) {
                    storeAttachment(claim, file);
                }
            }
        }

        // 4. Side effects run after commit
        events.publishEvent(new ClaimSubmittedEvent(claim.getId(), claim.getReferenceNumber(), policy.getPolicyholderId()));
        auditTrail.record(principal, AuditAction.CREATE, "Claim", claim.getId(),
                details("reference_number", claim.getReferenceNumber(), "requested_amount", claim.getRequestedAmount()));

        log.info("Claim {} submitted on policy {}", claim.getReferenceNumber(), policy.getMemberNumber());
        log.info("Exiting submit");
        return claim;
    }

    @Transactional(readOnly = true)
    public List<Claim> list(ClaimsPrincipal principal, String status, int page, int size) {
        accessPolicy.require(principal, Operation.READ_CLAIM);
        String statusFilter = (status == null || status.isBlank()) ? null : ClaimStatus.parse(status).name();
        return claimRepository.findVisible(statusFilter, claimAccess.ownerScope(principal),
                Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional(readOnly = true)
    public ClaimDetail get(ClaimsPrincipal principal, Long claimId) {
        accessPolicy.require(principal, Operation.READ_CLAIM);
        Claim claim = claimAccess.loadAccessibleClaim(principal, claimId);

        List<Payment> payments = accessPolicy.can(principal, Operation.READ_PAYMENT)
                ? paymentRepository.findByClaimId(claimId)
                : null;
        return new ClaimDetail(claim,
                attachmentRepository.findByClaimId(claimId),
                reviewService.viewsForClaim(claimId),
                payments);
    }

    /**
     * Corrects the submitted details. Only possible before the Claims Department has taken the
     * claim over, after that the amounts are under review.
     */
    @Transactional
    public Claim patch(ClaimsPrincipal principal, Long claimId, ClaimPatch patch) {
        accessPolicy.require(principal, Operation.UPDATE_CLAIM);
        Claim claim = claimAccess.loadAccessibleClaim(principal, claimId);
        if (claim.getStatus() != ClaimStatus.SUBMITTED && claim.getStatus() != ClaimStatus.UNDER_REVIEW_CS) {
            throw new InconsistentStateException("Claim " + claim.getReferenceNumber() + " can no longer be edited, it is "
                    + claim.getStatus());
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        if (patch.hospitalPharmacy() != null && !patch.hospitalPharmacy().isBlank()) {
            claim.setHospitalPharmacy(patch.hospitalPharmacy().trim());
            changes.put("hospital_pharmacy", claim.getHospitalPharmacy());
        }
        if (patch.reason() != null && !patch.reason().isBlank()) {
            claim.setReason(patch.reason().trim());
            changes.put("reason", claim.getReason());
        }
        if (patch.requestedAmount() != null) {
            claim.setRequestedAmount(patch.requestedAmount());
            changes.put("requested_amount", claim.getRequestedAmount());
        }
        if (changes.isEmpty()) {
            return claim;
        }
        claim.setUpdatedAt(Instant.now());
        claim = claimRepository.save(claim);

        auditTrail.record(principal, AuditAction.UPDATE, "Claim", claim.getId(), changes);
        return claim;
    }

    /**
     * Administrative correction that bypasses the review workflow.
     */
    @Transactional
    public Claim overrideStatus(ClaimsPrincipal principal, Long claimId, String status) {
        log.info("Entering overrideStatus");
        accessPolicy.require(principal, Operation.OVERRIDE_CLAIM_STATUS);
        ClaimStatus target = ClaimStatus.parse(status);
        Claim claim = claimAccess.loadClaim(claimId);

        ClaimStatus previous = claim.getStatus();
        claim.setStatus(target);
        claim.setUpdatedAt(Instant.now());
        claim = claimRepository.save(claim);

        events.publishEvent(new ClaimStatusChangedEvent(claim.getId(), claim.getReferenceNumber(),
                claimAccess.policyholderOf(claim), previous, target));
        auditTrail.record(principal, AuditAction.STATUS_CHANGE, "Claim", claim.getId(),
                details("old_status", previous, "new_status", target));

        log.warn("Claim {} status overridden {} -> {} by user {}", claim.getReferenceNumber(), previous, target,
                principal.userId());
        return claim;
    }

    @Transactional
    public ClaimAttachment addAttachment(ClaimsPrincipal principal, Long claimId, MultipartFile file) {
        accessPolicy.require(principal, Operation.MANAGE_ATTACHMENTS);
        Claim claim = claimAccess.loadAccessibleClaim(principal, claimId);

        ClaimAttachment attachment = storeAttachment(claim, file);
        auditTrail.record(principal, AuditAction.CREATE, "ClaimAttachment", attachment.getId(),
                details("claim_id", claimId, "file_name", attachment.getFileName()));
        return attachment;
    }

    @Transactional
    public void deleteAttachment(ClaimsPrincipal principal, Long claimId, Long attachmentId) {
        accessPolicy.require(principal, Operation.MANAGE_ATTACHMENTS);
        claimAccess.loadAccessibleClaim(principal, claimId);
        ClaimAttachment attachment = attachmentRepository.findByIdAndClaimId(attachmentId, claimId)
                .orElseThrow(() -> ResourceNotFoundException.of("Attachment", attachmentId));

        attachmentRepository.delete(attachment);
        deleteAfterCommit(attachment.getFilePath());

        auditTrail.record(principal, AuditAction.DELETE, "ClaimAttachment", attachmentId,
                details("claim_id", claimId, "file_name", attachment.getFileName()));
    }

    private ClaimAttachment storeAttachment(Claim claim, MultipartFile file) {
        StoredFile stored = storage.store(file);
        discardOnRollback(stored);

        ClaimAttachment attachment = new ClaimAttachment();
        attachment.setClaimId(claim.getId());
        attachment.setFileName(stored.originalName());
        attachment.setFilePath(stored.path());
        attachment.setFileType(stored.contentType());
        attachment.setUploadedAt(Instant.now());
        return attachmentRepository.save(attachment);
    }

    // a file written for a transaction that then rolls back would otherwise be orphaned
    private void discardOnRollback(StoredFile stored) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    try {
                        storage.delete(stored.path());
                    } catch (RuntimeException e) {
                        log.warn("Could not remove orphaned upload {}: {}", stored.path(), e.getMessage());
                    }
                }
            }
        });
    }

    // the row may still be rolled back, so the file goes only once the delete is committed
    private void deleteAfterCommit(String path) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            storage.delete(path);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    storage.delete(path);
                } catch (RuntimeException e) {
                    log.warn("Could not remove deleted attachment file {}: {}", path, e.getMessage());
                }
            }
        });
    }

    String nextReferenceNumber() {
        String candidate;
        do {
            byte[] random = new byte[4];
            ThreadLocalRandom.current().nextBytes(random);
            candidate = "CLM-" + HexFormat.of().withUpperCase().formatHex(random);
        } while (claimRepository.existsByReferenceNumber(candidate));
        return candidate;
    }
}
