package com.solusoft.medclaims.features.employers.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record EmployerRequest(
    @NotBlank String name,
    @NotBlank String contactPerson,
    @NotBlank @Email String contactEmail,
    @NotBlank String contactPhone
) {}
