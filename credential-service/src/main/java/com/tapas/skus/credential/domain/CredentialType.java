package com.tapas.skus.credential.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Credential kinds an order item can be issued with.
 */
public enum CredentialType {
    SINGLE_USE("single-use"),
    TIME_LIMITED("time-limited"),
    TIME_LIMITED_V2("time-limited-v2");

    private final String value;

    CredentialType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CredentialType> find(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
