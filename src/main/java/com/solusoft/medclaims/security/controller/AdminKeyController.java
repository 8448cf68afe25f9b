package com.solusoft.medclaims.security.controller;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.config.MedClaimsProperties;
import com.solusoft.medclaims.security.model.GenerateKeyRequest;
import com.solusoft.medclaims.security.model.PruneRequest;
import com.solusoft.medclaims.security.service.ApiKeyService;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/admin/keys")
@Slf4j
public class AdminKeyController {

    private final ApiKeyService apiKeyService;
    private final MedClaimsProperties properties;

    public AdminKeyController(ApiKeyService apiKeyService, MedClaimsProperties properties) {
        this.apiKeyService = apiKeyService;
        this.properties = properties;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generateNewKey(
            @RequestHeader(value = "X-ADMIN-SECRET", required = false) String secret,
            @Valid @RequestBody GenerateKeyRequest request) {

        if (!secretMatches(secret)) return forbidden();

        String plainTextKey = apiKeyService.createApiKey(request.userId());

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "status", "created",
            "user_id", request.userId(),
            "api_key", plainTextKey,
            "message", "Key created successfully. Older keys of this user remain active until pruned."
        ));
    }

    @PostMapping("/prune")
    public ResponseEntity<?> pruneOldKeys(
            @RequestHeader(value = "X-ADMIN-SECRET", required = false) String secret,
            @Valid @RequestBody PruneRequest request) {

        if (!secretMatches(secret)) return forbidden();

        int revokedCount = apiKeyService.revokeAllExceptLatest(request.userId());

        return ResponseEntity.ok(Map.of(
            "status", "pruned",
            "user_id", request.userId(),
            "keys_revoked", revokedCount,
            "message", revokedCount > 0
                ? "Kept the latest key, revoked " + revokedCount + " older ones."
                : "No cleanup needed. Only 1 key was active."
        ));
    }

    private boolean secretMatches(String presented) {
        String expected = properties.getAdminSecret();
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private ResponseEntity<?> forbidden() {
        log.warn("Security Alert: admin key endpoint called with an invalid secret");
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Invalid Admin Secret"));
    }
}
