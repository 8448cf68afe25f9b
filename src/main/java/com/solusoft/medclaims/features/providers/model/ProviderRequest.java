package com.solusoft.medclaims.features.providers.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record ProviderRequest(
    @NotBlank String name,
    @NotBlank String contactPerson,
    @NotBlank @Email String contactEmail,
    @NotBlank String contactPhone
) {}
