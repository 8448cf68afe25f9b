package com.solusoft.medclaims.features.reviews.model;

public enum ReviewType {
    CUSTOMER_SERVICE,
    CLAIMS,
    MD
}
