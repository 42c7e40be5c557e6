package com.tapas.skus.credential.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves messages that can never be processed to the dead-letter topic.
 */
@Component
public class DeadLetterPublisher {

    static final String REASON_HEADER = "x-dead-letter-reason";
    static final String ORIGINAL_TOPIC_HEADER = "x-original-topic";
    static final String ORIGINAL_OFFSET_HEADER = "x-original-offset";

    private static final Logger log =
            LoggerFactory.getLogger(DeadLetterPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${skus.kafka.signed-result-dlq-topic}")
    private String topic;

    @Value("${outbox.kafka-timeout-seconds:10}")
    private int kafkaTimeoutSeconds;

    public DeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * Publishes the record unchanged and waits for the broker ack.
     *
     * @throws KafkaException when the dead-letter write fails, so the original is not acknowledged
     */
    public void publish(ConsumerRecord<String, String> record, Exception cause) {
        var deadLetter = new ProducerRecord<>(topic, record.key(), record.value());
        deadLetter.headers()
                .add(REASON_HEADER, String.valueOf(cause.getMessage()).getBytes(StandardCharsets.UTF_8))
                .add(ORIGINAL_TOPIC_HEADER, record.topic().getBytes(StandardCharsets.UTF_8))
                .add(ORIGINAL_OFFSET_HEADER, String.valueOf(record.offset()).getBytes(StandardCharsets.UTF_8));

        try {
            kafkaTemplate.send(deadLetter).get(kafkaTimeoutSeconds, TimeUnit.SECONDS);
            log.info("Dead-lettered message {} from {}-{}@{}",
                    record.key(), record.topic(), record.partition(), record.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaException("Interrupted while dead-lettering message " + record.key(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new KafkaException("Failed to dead-letter message " + record.key(), e);
        }
    }
}
