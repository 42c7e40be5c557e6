package com.tapas.skus.credential.exception;

public class OrderUnpaidException extends CredentialException {

    public OrderUnpaidException(String orderId) {
        super("order " + orderId + " is not paid");
    }
}
