package com.tapas.skus.credential.exception;

public class InvalidArgumentException extends CredentialException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
