package com.solusoft.medclaims.exception;

/**
 * Base type for domain failures that the REST layer maps onto client responses.
 */
public abstract class ClaimsException extends RuntimeException {

    protected ClaimsException(String message) {
        super(message);
    }

    protected ClaimsException(String message, Throwable cause) {
        super(message, cause);
    }
}
