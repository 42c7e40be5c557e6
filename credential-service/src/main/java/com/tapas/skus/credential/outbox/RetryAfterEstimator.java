package com.tapas.skus.credential.outbox;

import com.tapas.skus.credential.repository.CredentialStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Tells polling clients how long to wait before asking again for signed credentials.
 * Derived from persisted outbox timestamps only, so restarts do not reset it.
 */
@Component
public class RetryAfterEstimator {

    static final long MIN_SECONDS = 1;

    private final CredentialStore credentialStore;

    @Value("${outbox.retry-after.window:20}")
    private int window;

    @Value("${outbox.retry-after.max-seconds:5}")
    private long maxSeconds;

    public RetryAfterEstimator(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * Moving average of completion time over the last completed signing requests, rounded up and kept in
     * [1, max-seconds].
     */
    public long estimateSeconds() {
        OptionalDouble avg = credentialStore.outboxAverageCompletionSeconds(window);
        if (avg.isEmpty()) {
            return MIN_SECONDS;
        }

        long seconds = (long) Math.ceil(avg.getAsDouble());
        return Math.max(MIN_SECONDS, Math.min(seconds, maxSeconds));
    }
}
