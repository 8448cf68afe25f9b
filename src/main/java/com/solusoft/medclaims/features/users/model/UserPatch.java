package com.solusoft.medclaims.features.users.model;

// null fields are left untouched
public record UserPatch(
    String fullName,
    String phone,
    Role role,
    Boolean active
) {}
