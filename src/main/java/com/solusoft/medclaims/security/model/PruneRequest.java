package com.solusoft.medclaims.security.model;

import jakarta.validation.constraints.NotNull;

public record PruneRequest(@NotNull Long userId) {}
