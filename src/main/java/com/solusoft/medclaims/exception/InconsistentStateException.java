package com.solusoft.medclaims.exception;

/**
 * The request is well formed but the target record is not in a state that allows it,
 * e.g. scheduling a payment against a claim that has not been approved.
 */
public class InconsistentStateException extends ClaimsException {

    public InconsistentStateException(String message) {
        super(message);
    }
}
