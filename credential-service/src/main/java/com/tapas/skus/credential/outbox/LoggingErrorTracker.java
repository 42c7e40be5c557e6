package com.tapas.skus.credential.outbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes captured failures to the {@code error-tracking} logger.
 */
@Component
public class LoggingErrorTracker implements ErrorTracker {

    private static final Logger log = LoggerFactory.getLogger("error-tracking");

    @Override
    public void capture(String message, Throwable error) {
        log.error(message, error);
    }
}
