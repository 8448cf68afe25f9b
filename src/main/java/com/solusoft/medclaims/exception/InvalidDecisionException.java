package com.solusoft.medclaims.exception;

/**
 * A review type / decision pair, or a status value, that the claim workflow does not accept.
 */
public class InvalidDecisionException extends ClaimsException {

    public InvalidDecisionException(String message) {
        super(message);
    }
}
