package com.solusoft.medclaims.features.reviews.model;

public enum ReviewItemStatus {
    APPROVED,
    REJECTED
}
