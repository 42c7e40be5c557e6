package com.tapas.skus.credential.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Associated data carried through the signer untouched, used to route a signed result back to its order item.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialMetadata(
        @JsonProperty("itemId") UUID itemId,
        @JsonProperty("orderId") UUID orderId,
        @JsonProperty("issuerId") UUID issuerId,
        @JsonProperty("credential_type") String credentialType
) {
    public boolean isComplete() {
        return itemId != null && orderId != null && issuerId != null
                && credentialType != null && !credentialType.isBlank();
    }
}
