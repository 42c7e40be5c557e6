package com.tapas.skus.credential.consumer;

import com.tapas.skus.credential.dto.SigningOrderResult;
import com.tapas.skus.credential.exception.CredentialException;
import com.tapas.skus.credential.service.SignedOrderCredentialsService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Reads signing results. A message is acknowledged once stored or dead-lettered; anything else is left for
 * redelivery.
 */
@Component
public class SignedOrderCredentialsConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(SignedOrderCredentialsConsumer.class);

    private final SignedOrderCredentialsService signedOrderCredentialsService;
    private final DeadLetterPublisher deadLetterPublisher;

    public SignedOrderCredentialsConsumer(SignedOrderCredentialsService signedOrderCredentialsService,
                                          DeadLetterPublisher deadLetterPublisher) {
        this.signedOrderCredentialsService = signedOrderCredentialsService;
        this.deadLetterPublisher = deadLetterPublisher;
    }

    @KafkaListener(
            topics = "${skus.kafka.signed-result-topic}",
            groupId = "${skus.kafka.consumer-group}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        try {
            SigningOrderResult result = signedOrderCredentialsService.decode(record.value());
            signedOrderCredentialsService.store(result);
            log.debug("Stored signing result {}", result.requestId());

        } catch (CredentialException e) {
            if (!e.isFatal()) {
                log.error("Failed to store signing result {}, will retry", record.key(), e);
                throw e;
            }
            log.error("Unprocessable signing result {} at {}-{}@{}, dead-lettering",
                    record.key(), record.topic(), record.partition(), record.offset(), e);
            deadLetterPublisher.publish(record, e);

        } catch (DataIntegrityViolationException e) {
            log.error("Signing result {} violates a credential constraint, dead-lettering", record.key(), e);
            deadLetterPublisher.publish(record, e);

        } catch (RuntimeException e) {
            log.error("Failed to store signing result {}, will retry", record.key(), e);
            throw e; // Kafka retry
        }

        ack.acknowledge();
    }
}
