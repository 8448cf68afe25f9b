package com.solusoft.medclaims.features.users.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.users.model.ProfileUpdate;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.model.UserRequest;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;

public class UserServiceTest {

    private static final ClaimsPrincipal ADMIN = new ClaimsPrincipal(1L, "admin@example.com", Role.ADMIN);
    private static final ClaimsPrincipal HOLDER = new ClaimsPrincipal(42L, "holder@example.com", Role.POLICYHOLDER);

    @Mock
    private UserRepository userRepository;

    @Mock
    private AuditTrail auditTrail;

    private UserService service;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        service = new UserService(userRepository, new AccessPolicy(), auditTrail);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User user = inv.getArgument(0);
            if (user.getId() == null) {
                user.setId(50L);
            }
            return user;
        });
    }

    private User existing(Long id) {
        User user = new User();
        user.setId(id);
        user.setEmail("user" + id + "@example.com");
        user.setRole(Role.POLICYHOLDER);
        when(userRepository.findById(id)).thenReturn(Optional.of(user));
        return user;
    }

    @Test
    public void testCreate_normalizesEmail() {
        when(userRepository.findByEmail("new.user@example.com")).thenReturn(Optional.empty());

        User user = service.create(ADMIN, new UserRequest(" New.User@Example.com ", "New User", null, Role.CLAIMS, null));

        assertEquals("new.user@example.com", user.getEmail());
        assertEquals(Role.CLAIMS, user.getRole());
        assertTrue(user.isActive());
    }

    @Test
    public void testCreate_duplicateEmail_throws() {
        when(userRepository.findByEmail("taken@example.com")).thenReturn(Optional.of(new User()));

        assertThrows(InconsistentStateException.class,
                () -> service.create(ADMIN, new UserRequest("taken@example.com", "Someone", null, Role.HR, true)));
        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    public void testCreate_nonAdmin_isDenied() {
        assertThrows(PermissionDeniedException.class,
                () -> service.create(HOLDER, new UserRequest("x@example.com", "X", null, Role.ADMIN, true)));
    }

    @Test
    public void testGet_ownRecord_isAllowedForAnyRole() {
        existing(42L);

        assertEquals(42L, service.get(HOLDER, 42L).getId());
    }

    @Test
    public void testGet_otherRecord_requiresAdmin() {
        existing(43L);

        assertThrows(PermissionDeniedException.class, () -> service.get(HOLDER, 43L));
    }

    @Test
    public void testDeactivate_keepsRowButMarksInactive() {
        User user = existing(43L);

        service.deactivate(ADMIN, 43L);

        assertFalse(user.isActive());
        verify(userRepository).save(user);
        verify(userRepository, never()).delete(any(User.class));
    }

    @Test
    public void testDeactivate_self_isRejected() {
        assertThrows(InconsistentStateException.class, () -> service.deactivate(ADMIN, 1L));
    }

    @Test
    public void testUpdateProfile_changesOwnContactDetails() {
        User user = existing(42L);
        user.setFullName("Old Name");
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.empty());

        User updated = service.updateProfile(HOLDER, new ProfileUpdate(" Jane@Example.com", " Jane Doe ", "555-0100"));

        assertEquals("jane@example.com", updated.getEmail());
        assertEquals("Jane Doe", updated.getFullName());
        assertEquals("555-0100", updated.getPhone());
        assertEquals(Role.POLICYHOLDER, updated.getRole());
        verify(auditTrail).record(eq(HOLDER), eq(AuditAction.UPDATE), eq("User"), eq(42L), anyMap());
    }

    @Test
    public void testUpdateProfile_emailTakenByAnotherUser_throws() {
        existing(42L);
        User other = new User();
        other.setId(43L);
        when(userRepository.findByEmail("taken@example.com")).thenReturn(Optional.of(other));

        assertThrows(InconsistentStateException.class,
                () -> service.updateProfile(HOLDER, new ProfileUpdate("taken@example.com", null, null)));
        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    public void testUpdateProfile_nothingChanged_skipsSave() {
        existing(42L);

        service.updateProfile(HOLDER, new ProfileUpdate("USER42@example.com", null, null));

        verify(userRepository, never()).save(any(User.class));
        verifyNoInteractions(auditTrail);
    }
}
