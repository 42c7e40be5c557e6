package com.tapas.skus.credential.repository;

import com.tapas.skus.credential.domain.OrderCreds;
import com.tapas.skus.credential.domain.SigningOrderRequestOutbox;
import com.tapas.skus.credential.domain.TimeLimitedV2Creds;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Storage operations of the signing outbox and the issued credential tables.
 * Every method joins the caller's transaction when there is one.
 */
public interface CredentialStore {

    /**
     * Enqueue a signing request.
     *
     * @throws com.tapas.skus.credential.exception.ConflictException if the request id is already enqueued
     */
    void insertSigningOrderRequestOutbox(UUID requestId, UUID orderId, UUID itemId, String messageData);

    /**
     * Lock up to {@code limit} unsubmitted rows, oldest first, skipping rows locked by another transaction.
     */
    List<SigningOrderRequestOutbox> lockUnsubmittedOutbox(int limit);

    /**
     * @return number of rows updated
     */
    int markOutboxSubmitted(Collection<UUID> requestIds, Instant submittedAt);

    /**
     * @return number of rows updated, zero when the request id is unknown
     */
    int markOutboxCompleted(UUID requestId, Instant completedAt);

    Optional<SigningOrderRequestOutbox> findOutboxByRequestId(UUID requestId);

    List<SigningOrderRequestOutbox> findOutboxByOrder(UUID orderId);

    List<SigningOrderRequestOutbox> findOutboxByOrderItem(UUID orderId, UUID itemId);

    /**
     * Average of completed_at - created_at in seconds over the {@code window} most recently completed rows.
     */
    OptionalDouble outboxAverageCompletionSeconds(int window);

    /**
     * @return false when credentials already exist for the item
     */
    boolean insertOrderCreds(OrderCreds creds);

    /**
     * @return false when the same item, request and window is already stored
     */
    boolean insertTimeLimitedV2Creds(TimeLimitedV2Creds creds);

    TimeLimitedV2SubmissionReport timeLimitedV2SubmissionReport(UUID requestId, List<String> blindedCreds);

    Optional<OrderCreds> findOrderCredsByItem(UUID orderId, UUID itemId);

    List<OrderCreds> findOrderCredsByOrder(UUID orderId);

    List<TimeLimitedV2Creds> findTimeLimitedV2Creds(UUID orderId, UUID itemId, UUID requestId);

    List<TimeLimitedV2Creds> findTimeLimitedV2CredsByOrder(UUID orderId);

    int deleteOutboxByOrder(UUID orderId);

    int deleteOrderCredsByOrder(UUID orderId);

    int deleteTimeLimitedV2CredsByOrder(UUID orderId);
}
