package com.solusoft.medclaims.exception;

public class PermissionDeniedException extends ClaimsException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
