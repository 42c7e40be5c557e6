package com.tapas.skus.credential.exception;

import com.tapas.skus.credential.dto.CredentialMetadata;
import com.tapas.skus.credential.dto.SignedOrderStatus;
import lombok.Getter;

/**
 * The signer rejected an item of a signing request.
 */
@Getter
public class UpstreamStatusException extends CredentialException {

    private final SignedOrderStatus status;
    private final CredentialMetadata metadata;

    public UpstreamStatusException(SignedOrderStatus status, CredentialMetadata metadata) {
        super(String.format("signer returned status %s for order %s item %s issuer %s",
                status, metadata.orderId(), metadata.itemId(), metadata.issuerId()));
        this.status = status;
        this.metadata = metadata;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
