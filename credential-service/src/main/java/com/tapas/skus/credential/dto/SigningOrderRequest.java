package com.tapas.skus.credential.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload published to the signer for one issuance request.
 */
public record SigningOrderRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("data") List<SigningOrder> data
) {
    public record SigningOrder(
            @JsonProperty("associated_data") byte[] associatedData,
            @JsonProperty("blinded_tokens") List<String> blindedTokens,
            @JsonProperty("issuer_type") String issuerType,
            @JsonProperty("issuer_cohort") int issuerCohort
    ) {
    }
}
