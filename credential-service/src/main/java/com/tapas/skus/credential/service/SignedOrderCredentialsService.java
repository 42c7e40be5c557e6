package com.tapas.skus.credential.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.skus.credential.domain.CredentialType;
import com.tapas.skus.credential.domain.OrderCreds;
import com.tapas.skus.credential.domain.TimeLimitedV2Creds;
import com.tapas.skus.credential.dto.CredentialMetadata;
import com.tapas.skus.credential.dto.SignedOrderStatus;
import com.tapas.skus.credential.dto.SigningOrderResult;
import com.tapas.skus.credential.dto.SigningOrderResult.SignedOrder;
import com.tapas.skus.credential.exception.DataIntegrityException;
import com.tapas.skus.credential.exception.NotFoundException;
import com.tapas.skus.credential.exception.UpstreamStatusException;
import com.tapas.skus.credential.repository.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

/**
 * Persists the credentials returned by the signer. Replays of the same result are no-ops.
 */
@Service
@Slf4j
public class SignedOrderCredentialsService {

    private final CredentialStore credentialStore;
    private final OrderExpiryGate orderExpiryGate;
    private final ObjectMapper objectMapper;

    public SignedOrderCredentialsService(CredentialStore credentialStore,
            OrderExpiryGate orderExpiryGate,
            ObjectMapper objectMapper) {
        this.credentialStore = credentialStore;
        this.orderExpiryGate = orderExpiryGate;
        this.objectMapper = objectMapper;
    }

    public SigningOrderResult decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new DataIntegrityException("signing result payload is empty");
        }
        try {
            return objectMapper.readValue(payload, SigningOrderResult.class);
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to decode signing result", e);
        }
    }

    /**
     * Stores every signed order of the result and completes its outbox row, all or nothing.
     *
     * @throws DataIntegrityException   when the result can never be stored
     * @throws UpstreamStatusException  when the signer rejected one of the orders
     */
    @Transactional
    public void store(SigningOrderResult result) {
        if (result.data() == null || result.data().isEmpty()) {
            throw new DataIntegrityException("signing result " + result.requestId() + " contains no signed orders");
        }
        UUID requestId = parseRequestId(result.requestId());

        for (SignedOrder signed : result.data()) {
            CredentialMetadata metadata = metadata(signed);

            if (signed.status() != SignedOrderStatus.OK) {
                log.error("Signer returned status {} for request {} order {} item {} issuer {}",
                        signed.status(), requestId, metadata.orderId(), metadata.itemId(), metadata.issuerId());
                throw new UpstreamStatusException(signed.status(), metadata);
            }
            if (isEmpty(signed.blindedTokens()) || isEmpty(signed.signedTokens())) {
                throw new DataIntegrityException(String.format(
                        "signed order for request %s item %s has no blinded or signed tokens",
                        requestId, metadata.itemId()));
            }

            CredentialType type = CredentialType.find(metadata.credentialType())
                    .orElseThrow(() -> new DataIntegrityException(
                            "unknown credential type " + metadata.credentialType()));
            switch (type) {
                case SINGLE_USE -> storeSingleUse(metadata, signed);
                case TIME_LIMITED_V2 -> storeTimeLimitedV2(requestId, metadata, signed);
                default -> throw new DataIntegrityException(
                        "credential type " + type.value() + " is not issued through the signer");
            }
        }

        if (credentialStore.markOutboxCompleted(requestId, Instant.now()) == 0) {
            log.debug("Signing request {} already completed or not in the outbox", requestId);
        }
    }

    private void storeSingleUse(CredentialMetadata metadata, SignedOrder signed) {
        var creds = new OrderCreds(
                metadata.itemId(),
                metadata.orderId(),
                metadata.issuerId(),
                signed.blindedTokens(),
                signed.signedTokens(),
                signed.proof(),
                signed.publicKey(),
                null);

        if (!credentialStore.insertOrderCreds(creds)) {
            log.warn("Single-use credentials already exist for order {} item {}, skipping",
                    metadata.orderId(), metadata.itemId());
        }
    }

    private void storeTimeLimitedV2(UUID requestId, CredentialMetadata metadata, SignedOrder signed) {
        Instant validFrom = parseTimestamp("valid_from", signed.validFrom(), metadata);
        Instant validTo = parseTimestamp("valid_to", signed.validTo(), metadata);

        boolean withinExpiry;
        try {
            withinExpiry = orderExpiryGate.allows(metadata.orderId(), validFrom);
        } catch (NotFoundException e) {
            throw new DataIntegrityException("signed order references unknown order " + metadata.orderId(), e);
        }

        // Results for orders that expired while signing are dropped.
        if (!withinExpiry) {
            log.warn("Dropping signed credentials for order {} item {} request {}: window starting {} is past order expiry",
                    metadata.orderId(), metadata.itemId(), requestId, validFrom);
            return;
        }

        var creds = new TimeLimitedV2Creds(
                metadata.orderId(),
                metadata.itemId(),
                requestId,
                metadata.issuerId(),
                signed.blindedTokens(),
                signed.signedTokens(),
                signed.proof(),
                signed.publicKey(),
                validFrom,
                validTo);

        if (!credentialStore.insertTimeLimitedV2Creds(creds)) {
            log.info("Time-limited-v2 credentials for item {} request {} window {} - {} already stored",
                    metadata.itemId(), requestId, validFrom, validTo);
        }
    }

    private CredentialMetadata metadata(SignedOrder signed) {
        if (signed.associatedData() == null || signed.associatedData().length == 0) {
            throw new DataIntegrityException("signed order has no associated data");
        }

        CredentialMetadata metadata;
        try {
            metadata = objectMapper.readValue(signed.associatedData(), CredentialMetadata.class);
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to decode associated data", e);
        }

        if (metadata == null || !metadata.isComplete()) {
            throw new DataIntegrityException("associated data is missing order, item, issuer or credential type");
        }
        return metadata;
    }

    private static UUID parseRequestId(String requestId) {
        if (requestId == null) {
            throw new DataIntegrityException("signing result has no request id");
        }
        try {
            return UUID.fromString(requestId);
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityException("invalid request id " + requestId, e);
        }
    }

    private static Instant parseTimestamp(String field, String value, CredentialMetadata metadata) {
        if (value == null || value.isBlank()) {
            throw new DataIntegrityException(field + " is required for item " + metadata.itemId());
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new DataIntegrityException("invalid " + field + " '" + value + "' for item " + metadata.itemId(), e);
        }
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
