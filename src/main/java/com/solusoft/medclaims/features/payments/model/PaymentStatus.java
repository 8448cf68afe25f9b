package com.solusoft.medclaims.features.payments.model;

public enum PaymentStatus {
    SCHEDULED,
    PROCESSED,
    FAILED
}
