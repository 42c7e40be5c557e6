package com.tapas.skus.credential.api.dto;

import com.tapas.skus.credential.domain.OrderCreds;

import java.util.List;
import java.util.UUID;

public record OrderCredentialsResponse(
        UUID id,
        UUID orderId,
        UUID issuerId,
        List<String> blindedCreds,
        List<String> signedCreds,
        String batchProof,
        String publicKey
) {
    public static OrderCredentialsResponse from(OrderCreds creds) {
        return new OrderCredentialsResponse(
                creds.itemId(),
                creds.orderId(),
                creds.issuerId(),
                creds.blindedCreds(),
                creds.signedCreds(),
                creds.batchProof(),
                creds.publicKey()
        );
    }
}
