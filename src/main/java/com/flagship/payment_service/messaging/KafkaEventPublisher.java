package com.flagship.payment_service.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_service.config.PaymentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes events to Kafka.
 *
 * Sends are synchronous: the call waits for the broker acknowledgment (bounded
 * by payment.publish.send-timeout) so the caller knows whether to retry.
 * Retrying is left to the caller.
 */
@Component
@ConditionalOnProperty(name = "payment.messaging.type", havingValue = "kafka", matchIfMissing = true)
@Slf4j
public class KafkaEventPublisher implements EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Duration sendTimeout;

    public KafkaEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                               ObjectMapper objectMapper,
                               PaymentProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.sendTimeout = properties.getPublish().getSendTimeout();
    }

    @Override
    public void publish(String topic, String key, Object event) {
        String payload = serialize(event);

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);

            // Wait for the send to complete
            SendResult<String, String> result = future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("Published event: topic={}, partition={}, offset={}, key={}",
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EventPublishException("Failed to publish to " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new EventPublishException(
                    "No acknowledgment from broker for " + topic + " within " + sendTimeout, e);
        }
    }

    private String serialize(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
