package com.tapas.skus.credential.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TimeLimitedV2Creds(
        UUID orderId,
        UUID itemId,
        UUID requestId,
        UUID issuerId,
        List<String> blindedCreds,
        List<String> signedCreds,
        String batchProof,
        String publicKey,
        Instant validFrom,
        Instant validTo
) {
}
