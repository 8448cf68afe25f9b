package com.solusoft.medclaims.features.users.controller;

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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.users.model.ProfileUpdate;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.model.UserPatch;
import com.solusoft.medclaims.features.users.model.UserRequest;
import com.solusoft.medclaims.features.users.service.UserService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping("/me")
    public User me(@AuthenticationPrincipal ClaimsPrincipal principal) {
        return userService.me(principal);
    }

    @Audited("update_profile")
    @PutMapping("/me")
    public User updateMe(@AuthenticationPrincipal ClaimsPrincipal principal,
                         @Valid @RequestBody ProfileUpdate update) {
        return userService.updateProfile(principal, update);
    }

    @Audited("create_user")
    @PostMapping
    public ResponseEntity<User> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                       @Valid @RequestBody UserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(principal, request));
    }

    @GetMapping
    public List<User> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                           @RequestParam(defaultValue = "0") int page,
                           @RequestParam(defaultValue = "20") int size) {
        return userService.list(principal, page, size);
    }

    @GetMapping("/{userId}")
    public User get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long userId) {
        return userService.get(principal, userId);
    }

    @Audited("patch_user")
    @PatchMapping("/{userId}")
    public User patch(@AuthenticationPrincipal ClaimsPrincipal principal,
                      @PathVariable Long userId,
                      @Valid @RequestBody UserPatch patch) {
        return userService.patch(principal, userId, patch);
    }

    @Audited("deactivate_user")
    @DeleteMapping("/{userId}")
    public Map<String, Object> delete(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long userId) {
        userService.deactivate(principal, userId);
        return Map.of("message", "User deactivated successfully");
    }
}
