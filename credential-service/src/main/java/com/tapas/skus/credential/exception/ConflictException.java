package com.tapas.skus.credential.exception;

public class ConflictException extends CredentialException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
