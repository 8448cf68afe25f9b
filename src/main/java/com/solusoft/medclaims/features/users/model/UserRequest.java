package com.solusoft.medclaims.features.users.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UserRequest(
    @NotBlank @Email String email,
    @NotBlank String fullName,
    String phone,
    @NotNull Role role,
    Boolean active
) {}
