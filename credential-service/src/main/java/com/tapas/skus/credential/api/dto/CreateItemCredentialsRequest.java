package com.tapas.skus.credential.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateItemCredentialsRequest(
        @NotEmpty List<String> blindedCreds
) {
}
