package com.tapas.skus.credential.service;

import com.tapas.skus.credential.domain.OrderCreds;
import com.tapas.skus.credential.domain.SigningOrderRequestOutbox;
import com.tapas.skus.credential.domain.TimeLimitedV2Creds;
import com.tapas.skus.credential.exception.InvalidArgumentException;
import com.tapas.skus.credential.exception.NotFoundException;
import com.tapas.skus.credential.repository.CredentialStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class CredentialQueryService {

    static final String NOT_SUBMITTED = "no order credentials have been submitted for signing";

    private final CredentialStore credentialStore;

    public CredentialQueryService(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    public CredentialsLookup<OrderCreds> singleUseCredentials(UUID orderId, UUID itemId) {
        List<SigningOrderRequestOutbox> outbox = credentialStore.findOutboxByOrderItem(orderId, itemId);
        if (outbox.isEmpty()) {
            throw new NotFoundException(NOT_SUBMITTED);
        }
        if (!outbox.stream().allMatch(SigningOrderRequestOutbox::isCompleted)) {
            return CredentialsLookup.inProgress();
        }

        OrderCreds creds = credentialStore.findOrderCredsByItem(orderId, itemId)
                .orElseThrow(() -> new NotFoundException("credentials do not exist"));
        if (creds.signedCreds() == null || creds.signedCreds().isEmpty()) {
            return CredentialsLookup.inProgress();
        }
        return CredentialsLookup.ready(List.of(creds));
    }

    /**
     * Unexpired credentials of one issuance request. Empty once every window has passed.
     */
    public CredentialsLookup<TimeLimitedV2Creds> timeLimitedV2Credentials(UUID orderId, UUID itemId, UUID requestId) {
        SigningOrderRequestOutbox outbox = credentialStore.findOutboxByRequestId(requestId)
                .orElseThrow(() -> new NotFoundException(NOT_SUBMITTED));

        if (!outbox.orderId().equals(orderId) || !outbox.itemId().equals(itemId)) {
            throw new InvalidArgumentException("signed request order id does not belong to request id");
        }
        if (!outbox.isCompleted()) {
            return CredentialsLookup.inProgress();
        }

        Instant now = Instant.now();
        return CredentialsLookup.ready(credentialStore.findTimeLimitedV2Creds(orderId, itemId, requestId).stream()
                .filter(c -> c.validTo().isAfter(now))
                .toList());
    }
}
