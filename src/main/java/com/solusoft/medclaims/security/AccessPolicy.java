package com.solusoft.medclaims.security;

import static com.solusoft.medclaims.security.Operation.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.features.reviews.model.ReviewType;
import com.solusoft.medclaims.features.users.model.Role;

/**
 * Central capability table: which role may perform which operation, and which review
 * type each reviewer role is allowed to record. Ownership scoping of individual records
 * happens in the services on top of this check.
 */
@Component
public class AccessPolicy {

    private static final Map<Role, Set<Operation>> CAPABILITIES = new EnumMap<>(Role.class);
    private static final Map<Role, ReviewType> REVIEW_TYPE_BY_ROLE = new EnumMap<>(Role.class);

    static {
        CAPABILITIES.put(Role.POLICYHOLDER, EnumSet.of(
                SUBMIT_CLAIM, READ_CLAIM, UPDATE_CLAIM, MANAGE_ATTACHMENTS,
                READ_REVIEW, READ_PAYMENT, READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.HR, EnumSet.of(
                SUBMIT_CLAIM, READ_CLAIM, UPDATE_CLAIM, MANAGE_ATTACHMENTS,
                READ_REVIEW, MANAGE_POLICIES, READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.CUSTOMER_SERVICE, EnumSet.of(
                READ_CLAIM, UPDATE_CLAIM, MANAGE_ATTACHMENTS,
                CREATE_REVIEW, UPDATE_REVIEW, READ_REVIEW, READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.CLAIMS, EnumSet.of(
                READ_CLAIM, CREATE_REVIEW, UPDATE_REVIEW, READ_REVIEW, READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.MD, EnumSet.of(
                READ_CLAIM, CREATE_REVIEW, UPDATE_REVIEW, READ_REVIEW, READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.FINANCE, EnumSet.of(
                READ_CLAIM, READ_REVIEW, CREATE_PAYMENT, UPDATE_PAYMENT, READ_PAYMENT,
                READ_POLICIES, READ_REFERENCE_DATA));
        CAPABILITIES.put(Role.ADMIN, EnumSet.allOf(Operation.class));

        REVIEW_TYPE_BY_ROLE.put(Role.CUSTOMER_SERVICE, ReviewType.CUSTOMER_SERVICE);
        REVIEW_TYPE_BY_ROLE.put(Role.CLAIMS, ReviewType.CLAIMS);
        REVIEW_TYPE_BY_ROLE.put(Role.MD, ReviewType.MD);
    }

    public boolean can(ClaimsPrincipal principal, Operation operation) {
        if (principal == null || principal.role() == null) {
            return false;
        }
        return CAPABILITIES.getOrDefault(principal.role(), Collections.emptySet()).contains(operation);
    }

    public void require(ClaimsPrincipal principal, Operation operation) {
        if (!can(principal, operation)) {
            throw new PermissionDeniedException("Role " + (principal == null ? "ANONYMOUS" : principal.role())
                    + " is not permitted to " + operation);
        }
    }

    /**
     * Review type a reviewer role is restricted to; empty for roles without a fixed type (ADMIN)
     * or without review rights at all.
     */
    public Optional<ReviewType> reviewTypeOf(Role role) {
        return Optional.ofNullable(REVIEW_TYPE_BY_ROLE.get(role));
    }

    public void requireReviewType(ClaimsPrincipal principal, ReviewType reviewType) {
        require(principal, CREATE_REVIEW);
        if (principal.isAdmin()) {
            return;
        }
        ReviewType allowed = REVIEW_TYPE_BY_ROLE.get(principal.role());
        if (allowed != reviewType) {
            throw new PermissionDeniedException("Role " + principal.role() + " may not record a "
                    + reviewType + " review");
        }
    }
}
