package com.tapas.skus.credential.exception;

/**
 * A message that can never be processed: malformed payload, missing metadata, bad timestamps, empty results.
 */
public class DataIntegrityException extends CredentialException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
