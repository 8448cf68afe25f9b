package com.solusoft.medclaims.features.policies.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.policies.model.Policy;
import com.solusoft.medclaims.features.policies.model.PolicyPatch;
import com.solusoft.medclaims.features.policies.model.PolicyRequest;
import com.solusoft.medclaims.features.policies.service.PolicyService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final PolicyService policyService;

    public PolicyController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @Audited("create_policy")
    @PostMapping
    public ResponseEntity<Policy> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                         @Valid @RequestBody PolicyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(policyService.create(principal, request));
    }

    @GetMapping
    public List<Policy> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                             @RequestParam(required = false) Long policyholderId,
                             @RequestParam(required = false) Long employerId,
                             @RequestParam(defaultValue = "0") int page,
                             @RequestParam(defaultValue = "20") int size) {
        return policyService.list(principal, policyholderId, employerId, page, size);
    }

    @GetMapping("/{policyId}")
    public Policy get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long policyId) {
        return policyService.get(principal, policyId);
    }

    @Audited("patch_policy")
    @PatchMapping("/{policyId}")
    public Policy patch(@AuthenticationPrincipal ClaimsPrincipal principal,
                        @PathVariable Long policyId,
                        @Valid @RequestBody PolicyPatch patch) {
        return policyService.patch(principal, policyId, patch);
    }

    @Audited("delete_policy")
    @DeleteMapping("/{policyId}")
    public Map<String, Object> delete(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long policyId) {
        policyService.delete(principal, policyId);
        return Map.of("message", "Policy deleted successfully");
    }
}
