package com.tapas.skus.credential.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SignedOrderStatus {
    @JsonProperty("ok")
    OK,
    @JsonProperty("invalid_issuer")
    INVALID_ISSUER,
    @JsonProperty("error")
    ERROR
}
