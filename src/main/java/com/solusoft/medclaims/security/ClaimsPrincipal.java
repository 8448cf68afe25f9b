package com.solusoft.medclaims.security;

import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;

/**
 * The authenticated caller as seen by the services: who they are and what role they act in.
 */
public record ClaimsPrincipal(Long userId, String email, Role role) {

    public static ClaimsPrincipal of(User user) {
        return new ClaimsPrincipal(user.getId(), user.getEmail(), user.getRole());
    }

    public boolean is(Role candidate) {
        return role == candidate;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
