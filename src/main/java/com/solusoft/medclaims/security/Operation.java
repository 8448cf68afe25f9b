package com.solusoft.medclaims.security;

public enum Operation {
    SUBMIT_CLAIM,
    READ_CLAIM,
    UPDATE_CLAIM,
    OVERRIDE_CLAIM_STATUS,
    MANAGE_ATTACHMENTS,
    CREATE_REVIEW,
    UPDATE_REVIEW,
    READ_REVIEW,
    CREATE_PAYMENT,
    UPDATE_PAYMENT,
    READ_PAYMENT,
    MANAGE_POLICIES,
    READ_POLICIES,
    MANAGE_REFERENCE_DATA,
    READ_REFERENCE_DATA,
    MANAGE_USERS,
    READ_AUDIT
}
