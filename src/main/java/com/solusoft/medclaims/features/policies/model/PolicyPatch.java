package com.solusoft.medclaims.features.policies.model;

import java.time.LocalDate;

public record PolicyPatch(
    String planType,
    Long policyholderId,
    Long employerId,
    LocalDate startDate,
    LocalDate endDate,
    Boolean active
) {}
