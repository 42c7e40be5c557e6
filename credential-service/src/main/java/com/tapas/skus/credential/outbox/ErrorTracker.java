package com.tapas.skus.credential.outbox;

/**
 * Sink for failures that are logged and not retried, so they stay visible outside the service log.
 */
public interface ErrorTracker {

    void capture(String message, Throwable error);
}
