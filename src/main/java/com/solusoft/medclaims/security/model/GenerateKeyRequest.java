package com.solusoft.medclaims.security.model;

import jakarta.validation.constraints.NotNull;

public record GenerateKeyRequest(@NotNull Long userId) {}
