package com.tapas.skus.credential.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Single-use credentials of an order item. Keyed by item id.
 */
public record OrderCreds(
        UUID itemId,
        UUID orderId,
        UUID issuerId,
        List<String> blindedCreds,
        List<String> signedCreds,
        String batchProof,
        String publicKey,
        Instant createdAt
) {
}
