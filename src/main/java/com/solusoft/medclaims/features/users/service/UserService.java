package com.solusoft.medclaims.features.users.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.users.model.ProfileUpdate;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.model.UserPatch;
import com.solusoft.medclaims.features.users.model.UserRequest;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;

    public UserService(UserRepository userRepository, AccessPolicy accessPolicy, AuditTrail auditTrail) {
        this.userRepository = userRepository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public User create(ClaimsPrincipal principal, UserRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_USERS);
        String email = normalizeEmail(request.email());
        if (userRepository.findByEmail(email).isPresent()) {
            throw new InconsistentStateException("A user with email " + email + " already exists");
        }

        Instant now = Instant.now();
        User user = new User();
        user.setEmail(email);
        user.setFullName(request.fullName().trim());
        user.setPhone(request.phone());
        user.setRole(request.role());
        user.setActive(request.active() == null || request.active());
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user = userRepository.save(user);

        auditTrail.record(principal, AuditAction.CREATE, "User", user.getId(),
                details("email", email, "role", user.getRole()));
        log.info("Created user {} with role {}", user.getId(), user.getRole());
        return user;
    }

    @Transactional(readOnly = true)
    public List<User> list(ClaimsPrincipal principal, int page, int size) {
        accessPolicy.require(principal, Operation.MANAGE_USERS);
        return userRepository.findPage(Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional(readOnly = true)
    public User get(ClaimsPrincipal principal, Long userId) {
        if (!principal.userId().equals(userId)) {
            accessPolicy.require(principal, Operation.MANAGE_USERS);
        }
        return load(userId);
    }

    @Transactional(readOnly = true)
    public User me(ClaimsPrincipal principal) {
        return load(principal.userId());
    }

    @Transactional
    public User patch(ClaimsPrincipal principal, Long userId, UserPatch patch) {
        accessPolicy.require(principal, Operation.MANAGE_USERS);
        User user = load(userId);
        if (patch.fullName() != null && !patch.fullName().isBlank()) {
            user.setFullName(patch.fullName().trim());
        }
        if (patch.phone() != null) {
            user.setPhone(patch.phone());
        }
        if (patch.role() != null) {
            user.setRole(patch.role());
        }
        if (patch.active() != null) {
            user.setActive(patch.active());
        }
        user.setUpdatedAt(Instant.now());
        user = userRepository.save(user);

        auditTrail.record(principal, AuditAction.UPDATE, "User", userId,
                details("role", user.getRole(), "active", user.isActive()));
        return user;
    }

    /**
     * Self-service edit of the caller's own contact details. Any active user may do this; an
     * email change must stay unique.
     */
    @Transactional
    public User updateProfile(ClaimsPrincipal principal, ProfileUpdate update) {
        log.info("Entering updateProfile for user {}", principal.userId());
        User user = load(principal.userId());
        List<String> updatedFields = new ArrayList<>();

        if (update.email() != null && !update.email().isBlank()) {
            String email = normalizeEmail(update.email());
            if (!email.equals(user.getEmail())) {
                userRepository.findByEmail(email)
                        .filter(other -> !other.getId().equals(user.getId()))
                        .ifPresent(other -> {
                            throw new InconsistentStateException("A user with email " + email + " already exists");
                        });
                user.setEmail(email);
                updatedFields.add("email");
            }
        }
        if (update.fullName() != null && !update.fullName().isBlank()) {
            user.setFullName(update.fullName().trim());
            updatedFields.add("full_name");
        }
        if (update.phone() != null) {
            user.setPhone(update.phone().isBlank() ? null : update.phone().trim());
            updatedFields.add("phone");
        }
        if (updatedFields.isEmpty()) {
            return user;
        }
        user.setUpdatedAt(Instant.now());
        User saved = userRepository.save(user);

        auditTrail.record(principal, AuditAction.UPDATE, "User", saved.getId(),
                details("updated_fields", updatedFields));
        return saved;
    }

    /**
     * Users are referenced by policies, reviews and payments, so removal only deactivates them.
     */
    @Transactional
    public void deactivate(ClaimsPrincipal principal, Long userId) {
        accessPolicy.require(principal, Operation.MANAGE_USERS);
        if (principal.userId().equals(userId)) {
            throw new InconsistentStateException("Administrators cannot deactivate themselves");
        }
        User user = load(userId);
        user.setActive(false);
        user.setUpdatedAt(Instant.now());
        userRepository.save(user);

        auditTrail.record(principal, AuditAction.DELETE, "User", userId);
        log.info("Deactivated user {}", userId);
    }

    private User load(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
