package com.tapas.skus.credential.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.skus.credential.domain.CredentialType;
import com.tapas.skus.credential.domain.Issuer;
import com.tapas.skus.credential.domain.Order;
import com.tapas.skus.credential.domain.OrderItem;
import com.tapas.skus.credential.domain.SigningOrderRequestOutbox;
import com.tapas.skus.credential.dto.CredentialMetadata;
import com.tapas.skus.credential.dto.SigningOrderRequest;
import com.tapas.skus.credential.exception.ConflictException;
import com.tapas.skus.credential.exception.DataIntegrityException;
import com.tapas.skus.credential.exception.InvalidArgumentException;
import com.tapas.skus.credential.exception.NotFoundException;
import com.tapas.skus.credential.exception.OrderUnpaidException;
import com.tapas.skus.credential.repository.CredentialStore;
import com.tapas.skus.credential.repository.IssuerRepository;
import com.tapas.skus.credential.repository.OrderItemRepository;
import com.tapas.skus.credential.repository.OrderRepository;
import com.tapas.skus.credential.repository.TimeLimitedV2SubmissionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts blinded credentials for a paid order item and queues them for signing.
 */
@Service
@Slf4j
public class CredentialIssuanceService {

    static final int DEFAULT_ISSUER_COHORT = 1;

    private final CredentialStore credentialStore;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final IssuerRepository issuerRepository;
    private final ObjectMapper objectMapper;

    public CredentialIssuanceService(
            CredentialStore credentialStore,
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            IssuerRepository issuerRepository,
            ObjectMapper objectMapper
    ) {
        this.credentialStore = credentialStore;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.issuerRepository = issuerRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * @return true when a signing request was enqueued, false when the same credentials were already submitted
     */
    @Transactional
    public boolean createOrderCredentials(UUID orderId, UUID itemId, UUID requestId, List<String> blindedCreds) {
        if (blindedCreds == null || blindedCreds.isEmpty()) {
            throw new InvalidArgumentException("at least one blinded credential is required");
        }

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("order " + orderId + " not found"));
        if (!order.isPaid()) {
            throw new OrderUnpaidException(orderId.toString());
        }

        OrderItem item = orderItemRepository.findByIdAndOrderId(itemId, orderId)
                .orElseThrow(() -> new NotFoundException("order item " + itemId + " not found"));

        CredentialType type = CredentialType.find(item.getCredentialType())
                .orElseThrow(() -> new InvalidArgumentException(
                        "order item " + itemId + " has unknown credential type " + item.getCredentialType()));

        switch (type) {
            case TIME_LIMITED_V2 -> {
                TimeLimitedV2SubmissionReport report =
                        credentialStore.timeLimitedV2SubmissionReport(requestId, blindedCreds);
                if (report.alreadySubmitted()) {
                    log.info("Credentials for order {} item {} request {} already submitted",
                            orderId, itemId, requestId);
                    return false;
                }
                if (report.mismatch()) {
                    throw new ConflictException(
                            "request id " + requestId + " was already used with different credentials");
                }
                Optional<SigningOrderRequestOutbox> queued = credentialStore.findOutboxByRequestId(requestId);
                if (queued.isPresent()) {
                    if (!isSameRequest(queued.get(), orderId, itemId, blindedCreds)) {
                        throw new ConflictException(
                                "request id " + requestId + " was already used with different credentials");
                    }
                    log.info("Signing request {} for order {} item {} already enqueued", requestId, orderId, itemId);
                    return false;
                }
            }
            case SINGLE_USE -> {
                if (!credentialStore.findOutboxByOrderItem(orderId, itemId).isEmpty()) {
                    throw new ConflictException("credentials for order item " + itemId + " already submitted");
                }
            }
            default -> throw new InvalidArgumentException(
                    "credential type " + type.value() + " is not issued through signing requests");
        }

        String issuerName = encodeIssuerId(order.getMerchantId(), item.getSku());
        Issuer issuer = issuerRepository.findByName(issuerName)
                .orElseThrow(() -> new NotFoundException("issuer " + issuerName + " not found"));

        var metadata = new CredentialMetadata(itemId, orderId, issuer.getId(), type.value());
        var request = new SigningOrderRequest(
                requestId.toString(),
                List.of(new SigningOrderRequest.SigningOrder(
                        toJson(metadata),
                        blindedCreds,
                        issuerName,
                        DEFAULT_ISSUER_COHORT)));

        credentialStore.insertSigningOrderRequestOutbox(requestId, orderId, itemId, toJsonString(request));
        log.info("Enqueued signing request {} for order {} item {} ({} creds)",
                requestId, orderId, itemId, blindedCreds.size());
        return true;
    }

    /**
     * Removes every signing request and issued credential of the order.
     */
    @Transactional
    public void deleteOrderCredentials(UUID orderId) {
        if (!orderRepository.existsById(orderId)) {
            throw new NotFoundException("order " + orderId + " not found");
        }

        int outbox = credentialStore.deleteOutboxByOrder(orderId);
        int singleUse = credentialStore.deleteOrderCredsByOrder(orderId);
        int timeLimited = credentialStore.deleteTimeLimitedV2CredsByOrder(orderId);
        log.info("Deleted credentials of order {}: {} outbox, {} single-use, {} time-limited-v2",
                orderId, outbox, singleUse, timeLimited);
    }

    static String encodeIssuerId(String merchantId, String sku) {
        return merchantId + "?sku=" + URLEncoder.encode(sku, StandardCharsets.UTF_8);
    }

    private boolean isSameRequest(SigningOrderRequestOutbox queued, UUID orderId, UUID itemId,
            List<String> blindedCreds) {
        if (!orderId.equals(queued.orderId()) || !itemId.equals(queued.itemId())) {
            return false;
        }
        SigningOrderRequest request;
        try {
            request = objectMapper.readValue(queued.messageData(), SigningOrderRequest.class);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("Failed to decode queued signing request " + queued.requestId(), e);
        }
        return request.data() != null
                && request.data().stream().anyMatch(o -> blindedCreds.equals(o.blindedTokens()));
    }

    private byte[] toJson(CredentialMetadata metadata) {
        try {
            return objectMapper.writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize credential metadata", e);
        }
    }

    private String toJsonString(SigningOrderRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SigningOrderRequest", e);
        }
    }
}
