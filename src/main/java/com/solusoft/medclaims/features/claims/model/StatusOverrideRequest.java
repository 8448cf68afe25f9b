package com.solusoft.medclaims.features.claims.model;

import jakarta.validation.constraints.NotBlank;

public record StatusOverrideRequest(@NotBlank String status) {}
