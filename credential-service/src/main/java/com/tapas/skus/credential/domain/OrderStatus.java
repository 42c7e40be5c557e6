package com.tapas.skus.credential.domain;

public enum OrderStatus {
    PENDING("pending"),
    PAID("paid"),
    FULFILLED("fulfilled"),
    CANCELED("canceled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
