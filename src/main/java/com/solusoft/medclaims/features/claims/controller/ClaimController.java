package com.solusoft.medclaims.features.claims.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimAttachment;
import com.solusoft.medclaims.features.claims.model.ClaimDetail;
import com.solusoft.medclaims.features.claims.model.ClaimPatch;
import com.solusoft.medclaims.features.claims.model.StatusOverrideRequest;
import com.solusoft.medclaims.features.claims.model.SubmitClaimRequest;
import com.solusoft.medclaims.features.claims.service.ClaimService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/claims")
public class ClaimController {

    private final ClaimService claimService;

    public ClaimController(ClaimService claimService) {
        this.claimService = claimService;
    }

    /**
     * Multipart form: the claim fields as form values, documents as repeated {@code attachments} parts.
     */
    @Audited("submit_claim")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> submit(@AuthenticationPrincipal ClaimsPrincipal principal,
                                                      @Valid @ModelAttribute SubmitClaimRequest request,
                                                      @RequestPart(value = "attachments", required = false) List<MultipartFile> attachments) {
        Claim claim = claimService.submit(principal, request, attachments);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "id", claim.getId(),
            "reference_number", claim.getReferenceNumber(),
            "status", claim.getStatus(),
            "message", "Claim submitted successfully"
        ));
    }

    @GetMapping
    public List<Claim> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                            @RequestParam(required = false) String status,
                            @RequestParam(defaultValue = "0") int page,
                            @RequestParam(defaultValue = "20") int size) {
        return claimService.list(principal, status, page, size);
    }

    @GetMapping("/{claimId}")
    public ClaimDetail get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long claimId) {
        return claimService.get(principal, claimId);
    }

    @Audited("patch_claim")
    @PatchMapping("/{claimId}")
    public Claim patch(@AuthenticationPrincipal ClaimsPrincipal principal,
                       @PathVariable Long claimId,
                       @Valid @RequestBody ClaimPatch patch) {
        return claimService.patch(principal, claimId, patch);
    }

    @Audited("override_claim_status")
    @PutMapping("/{claimId}/status")
    public Map<String, Object> overrideStatus(@AuthenticationPrincipal ClaimsPrincipal principal,
                                              @PathVariable Long claimId,
                                              @Valid @RequestBody StatusOverrideRequest request) {
        Claim claim = claimService.overrideStatus(principal, claimId, request.status());
        return Map.of(
            "id", claim.getId(),
            "reference_number", claim.getReferenceNumber(),
            "status", claim.getStatus(),
            "message", "Claim status updated successfully"
        );
    }

    @Audited("upload_attachment")
    @PostMapping(value = "/{claimId}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ClaimAttachment> uploadAttachment(@AuthenticationPrincipal ClaimsPrincipal principal,
                                                            @PathVariable Long claimId,
                                                            @RequestPart("attachment") MultipartFile attachment) {
        return ResponseEntity.status(HttpStatus.CREATED).body(claimService.addAttachment(principal, claimId, attachment));
    }

    @Audited("delete_attachment")
    @DeleteMapping("/{claimId}/attachments/{attachmentId}")
    public Map<String, Object> deleteAttachment(@AuthenticationPrincipal ClaimsPrincipal principal,
                                                @PathVariable Long claimId,
                                                @PathVariable Long attachmentId) {
        claimService.deleteAttachment(principal, claimId, attachmentId);
        return Map.of("message", "Attachment deleted successfully");
    }
}
