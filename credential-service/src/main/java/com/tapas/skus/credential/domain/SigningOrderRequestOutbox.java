package com.tapas.skus.credential.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * One pending or processed signing request. Moves from unsubmitted to submitted to completed, never back.
 */
public record SigningOrderRequestOutbox(
        UUID requestId,
        UUID orderId,
        UUID itemId,
        String messageData,
        Instant createdAt,
        Instant submittedAt,
        Instant completedAt
) {
    public boolean isCompleted() {
        return completedAt != null;
    }
}
