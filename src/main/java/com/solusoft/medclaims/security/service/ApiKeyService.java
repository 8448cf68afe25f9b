package com.solusoft.medclaims.security.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.model.ApiKeyEntity;
import com.solusoft.medclaims.security.repository.ApiKeyRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Issues, resolves and revokes the API keys that identify callers. Only the SHA-256 hash
 * of a key is stored; the plain text is handed out exactly once.
 */
@Service
@Slf4j
public class ApiKeyService {

    private final ApiKeyRepository repository;
    private final UserRepository userRepository;
    private final SecureRandom secureRandom = new SecureRandom();

    public ApiKeyService(ApiKeyRepository repository, UserRepository userRepository) {
        this.repository = repository;
        this.userRepository = userRepository;
    }

    /**
     * Entry point for the authentication filter. Resolves a presented key to the principal
     * of its (active) owner.
     */
    public Optional<ClaimsPrincipal> authenticate(String plainTextKey) {
        String inputHash = hashKey(plainTextKey);
        return repository.findByHash(inputHash)
                .flatMap(key -> userRepository.findById(key.getUserId()))
                .filter(User::isActive)
                .map(ClaimsPrincipal::of);
    }

    @Transactional
    public String createApiKey(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        if (!user.isActive()) {
            throw new InconsistentStateException("Cannot issue a key for inactive user " + userId);
        }

        byte[] randomBytes = new byte[32];
        secureRandom.nextBytes(randomBytes);
        String plainTextKey = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);

        ApiKeyEntity entity = new ApiKeyEntity();
        entity.setKeyHash(hashKey(plainTextKey));
        entity.setUserId(userId);
        entity.setOwner(user.getEmail());
        entity.setActive(true);
        repository.save(entity);

        log.info("Issued API key for user {} ({})", userId, user.getRole());
        return plainTextKey;
    }

    /**
     * Deactivates every active key of the user except the most recently issued one.
     *
     * @return number of keys revoked
     */
    @Transactional
    public int revokeAllExceptLatest(Long userId) {
        List<ApiKeyEntity> activeKeys = repository.findActiveByUser(userId);

        if (activeKeys.size() <= 1) {
            return 0;
        }

        // newest first
        activeKeys.sort(Comparator.comparing(ApiKeyEntity::getId).reversed());

        int revokedCount = 0;
        for (int i = 1; i < activeKeys.size(); i++) {
            ApiKeyEntity oldKey = activeKeys.get(i);
            oldKey.setActive(false);
            repository.save(oldKey);
            revokedCount++;
        }

        log.info("Revoked {} API keys of user {}", revokedCount, userId);
        return revokedCount;
    }

    public String hashKey(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
