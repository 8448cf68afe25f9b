package com.solusoft.medclaims.features.policyholders.controller;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.policyholders.model.DashboardSummary;
import com.solusoft.medclaims.features.policyholders.service.PolicyholderService;
import com.solusoft.medclaims.features.users.model.ProfileUpdate;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/policyholder")
public class PolicyholderController {

    private final PolicyholderService policyholderService;

    public PolicyholderController(PolicyholderService policyholderService) {
        this.policyholderService = policyholderService;
    }

    @GetMapping("/dashboard")
    public DashboardSummary dashboard(@AuthenticationPrincipal ClaimsPrincipal principal) {
        return policyholderService.dashboard(principal);
    }

    @GetMapping("/profile")
    public User profile(@AuthenticationPrincipal ClaimsPrincipal principal) {
        return policyholderService.profile(principal);
    }

    @Audited("update_profile")
    @PutMapping("/profile")
    public User updateProfile(@AuthenticationPrincipal ClaimsPrincipal principal,
                              @Valid @RequestBody ProfileUpdate update) {
        return policyholderService.updateProfile(principal, update);
    }
}
