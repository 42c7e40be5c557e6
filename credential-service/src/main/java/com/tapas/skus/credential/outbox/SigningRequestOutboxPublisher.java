package com.tapas.skus.credential.outbox;

import com.tapas.skus.credential.domain.SigningOrderRequestOutbox;
import com.tapas.skus.credential.repository.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends unsubmitted signing requests to the signer topic and marks them submitted.
 * Safe to run on several instances at once: rows locked by another dispatcher are skipped.
 */
@Component
@Slf4j
public class SigningRequestOutboxPublisher {

    private final CredentialStore credentialStore;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ErrorTracker errorTracker;

    @Value("${skus.kafka.signing-request-topic}")
    private String topic;

    @Value("${outbox.batch-size:10}")
    private int batchSize;

    @Value("${outbox.kafka-timeout-seconds:10}")
    private int kafkaTimeoutSeconds;

    public SigningRequestOutboxPublisher(CredentialStore credentialStore,
            KafkaTemplate<String, String> kafkaTemplate,
            ErrorTracker errorTracker) {
        this.credentialStore = credentialStore;
        this.kafkaTemplate = kafkaTemplate;
        this.errorTracker = errorTracker;
    }

    @Scheduled(fixedDelayString = "${outbox.dispatch-interval-ms:1000}")
    @Transactional
    public void publish() {
        dispatch(batchSize);
    }

    /**
     * Publishes at most {@code limit} of the oldest unsubmitted requests.
     * Failed writes are logged and reported but the rows are still marked submitted.
     *
     * @return number of rows marked submitted
     */
    @Transactional
    public int dispatch(int limit) {
        List<SigningOrderRequestOutbox> batch = credentialStore.lockUnsubmittedOutbox(limit);
        if (batch.isEmpty()) {
            return 0;
        }
        log.info("Dispatching {} signing requests (batch size: {})", batch.size(), limit);

        List<CompletableFuture<SendResult<String, String>>> pending = new ArrayList<>(batch.size());
        for (SigningOrderRequestOutbox row : batch) {
            pending.add(send(row));
        }

        int failed = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (!await(batch.get(i), pending.get(i))) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("{} of {} signing requests failed to publish and will not be retried", failed, batch.size());
        }

        var requestIds = batch.stream().map(SigningOrderRequestOutbox::requestId).toList();
        int updated = credentialStore.markOutboxSubmitted(requestIds, Instant.now());
        if (updated != batch.size()) {
            throw new IllegalStateException(String.format(
                    "marked %d signing requests submitted, expected %d", updated, batch.size()));
        }
        return updated;
    }

    private CompletableFuture<SendResult<String, String>> send(SigningOrderRequestOutbox row) {
        try {
            return kafkaTemplate.send(topic, row.requestId().toString(), row.messageData());
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private boolean await(SigningOrderRequestOutbox row, CompletableFuture<SendResult<String, String>> future) {
        try {
            var result = future.get(kafkaTimeoutSeconds, TimeUnit.SECONDS);
            log.debug("Published signing request {} to partition {} offset {}",
                    row.requestId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing signing request " + row.requestId(), ex);
        } catch (ExecutionException | TimeoutException ex) {
            Throwable cause = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
            log.error("Failed to publish signing request {} for order {}", row.requestId(), row.orderId(), cause);
            errorTracker.capture("signing request publish failed: " + row.requestId(), cause);
            return false;
        }
    }
}
