package com.solusoft.medclaims.features.claims.model;

import java.math.BigDecimal;

// one row per status: how many claims sit there and the approved money they carry
public record ClaimStatusTotal(ClaimStatus status, long claimCount, BigDecimal approvedTotal) {}
