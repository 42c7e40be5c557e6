package com.tapas.skus.credential.service;

import java.util.List;

/**
 * Credentials of an item, or a marker that signing is still in progress.
 */
public record CredentialsLookup<T>(boolean pending, List<T> credentials) {

    public static <T> CredentialsLookup<T> inProgress() {
        return new CredentialsLookup<>(true, List.of());
    }

    public static <T> CredentialsLookup<T> ready(List<T> credentials) {
        return new CredentialsLookup<>(false, credentials);
    }
}
