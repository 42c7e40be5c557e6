package com.tapas.skus.credential.exception;

/**
 * Base type for failures raised by the credential pipeline.
 */
public abstract class CredentialException extends RuntimeException {

    protected CredentialException(String message) {
        super(message);
    }

    protected CredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Fatal failures are never retried. A message that raised one goes to the dead-letter topic.
     */
    public boolean isFatal() {
        return false;
    }
}
