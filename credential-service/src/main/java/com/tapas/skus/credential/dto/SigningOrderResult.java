package com.tapas.skus.credential.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload received from the signer. One {@link SignedOrder} per signing order of the request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SigningOrderResult(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("data") List<SignedOrder> data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignedOrder(
            @JsonProperty("public_key") String publicKey,
            @JsonProperty("proof") String proof,
            @JsonProperty("status") SignedOrderStatus status,
            @JsonProperty("signed_tokens") List<String> signedTokens,
            @JsonProperty("blinded_tokens") List<String> blindedTokens,
            @JsonProperty("valid_to") String validTo,
            @JsonProperty("valid_from") String validFrom,
            @JsonProperty("associated_data") byte[] associatedData
    ) {
    }
}
