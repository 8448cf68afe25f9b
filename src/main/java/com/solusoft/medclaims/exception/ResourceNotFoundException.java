package com.solusoft.medclaims.exception;

public class ResourceNotFoundException extends ClaimsException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String entity, Object id) {
        return new ResourceNotFoundException(entity + " not found: " + id);
    }
}
