package com.solusoft.medclaims.features.users.model;

public enum Role {
    POLICYHOLDER,
    HR,
    CUSTOMER_SERVICE,
    CLAIMS,
    MD,
    FINANCE,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
