package com.tapas.skus.credential.api.dto;

import com.tapas.skus.credential.domain.TimeLimitedV2Creds;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TimeLimitedV2CredentialsResponse(
        UUID orderId,
        UUID itemId,
        UUID requestId,
        UUID issuerId,
        List<String> signedCreds,
        String batchProof,
        String publicKey,
        Instant validFrom,
        Instant validTo
) {
    public static TimeLimitedV2CredentialsResponse from(TimeLimitedV2Creds creds) {
        return new TimeLimitedV2CredentialsResponse(
                creds.orderId(),
                creds.itemId(),
                creds.requestId(),
                creds.issuerId(),
                creds.signedCreds(),
                creds.batchProof(),
                creds.publicKey(),
                creds.validFrom(),
                creds.validTo()
        );
    }
}
