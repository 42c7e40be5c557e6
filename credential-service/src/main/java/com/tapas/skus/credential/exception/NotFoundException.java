package com.tapas.skus.credential.exception;

public class NotFoundException extends CredentialException {

    public NotFoundException(String message) {
        super(message);
    }
}
