package com.solusoft.medclaims.features.policies.model;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PolicyRequest(
    @NotBlank String planType,
    @NotNull Long policyholderId,
    Long employerId,
    @NotNull LocalDate startDate,
    @NotNull LocalDate endDate,
    Boolean active
) {}
