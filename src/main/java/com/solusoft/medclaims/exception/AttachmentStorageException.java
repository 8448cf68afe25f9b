package com.solusoft.medclaims.exception;

public class AttachmentStorageException extends ClaimsException {

    public AttachmentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
