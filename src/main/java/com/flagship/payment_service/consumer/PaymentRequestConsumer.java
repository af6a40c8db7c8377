package com.flagship.payment_service.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_service.messaging.EventSubscriber;
import com.flagship.payment_service.messaging.Topics;
import com.flagship.payment_service.observability.CorrelationContext;
import com.flagship.payment_service.payment.PaymentProcessor;
import com.flagship.payment_service.payment.PaymentRequest;
import com.flagship.payment_service.payment.ProcessingResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Consumer for the payment-request topic.
 *
 * This consumer:
 * 1. Subscribes once the application is ready
 * 2. Unwraps CloudEvents envelopes (specversion + data) when present
 * 3. Deserializes the payload into a PaymentRequest
 * 4. Hands it to the PaymentProcessor, which publishes the terminal event
 *
 * A payload that cannot be read is answered with a payment-failed event and
 * not redelivered. Each message is processed under its own correlation id.
 */
@Component
@ConditionalOnProperty(name = "payment.consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentRequestConsumer {

    static final String CLOUD_EVENTS_VERSION = "specversion";
    static final String CLOUD_EVENTS_DATA = "data";

    private final EventSubscriber eventSubscriber;
    private final PaymentProcessor paymentProcessor;
    private final ObjectMapper objectMapper;

    private EventSubscriber.Subscription subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void subscribe() {
        subscription = eventSubscriber.subscribe(Topics.PAYMENT_REQUEST, this::onMessage);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    /**
     * Handles one raw message from the payment-request topic.
     */
    public ProcessingResult onMessage(String payload) {
        CorrelationContext.begin(null);
        try {
            PaymentRequest request;
            try {
                request = parse(payload);
            } catch (JsonProcessingException e) {
                return paymentProcessor.rejectMalformed(e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                return paymentProcessor.rejectMalformed(e.getMessage());
            }

            log.debug("Received payment request {}", request.getId());
            return paymentProcessor.process(request);

        } finally {
            CorrelationContext.clear();
        }
    }

    private PaymentRequest parse(String payload) throws JsonProcessingException {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("empty payload");
        }

        JsonNode node = objectMapper.readTree(payload);
        if (node.has(CLOUD_EVENTS_VERSION) && node.has(CLOUD_EVENTS_DATA)) {
            node = node.get(CLOUD_EVENTS_DATA);
            // Some publishers put the data in as a JSON string
            if (node.isTextual()) {
                node = objectMapper.readTree(node.asText());
            }
        }

        if (!node.isObject()) {
            throw new IllegalArgumentException("payload is not a JSON object");
        }
        return objectMapper.treeToValue(node, PaymentRequest.class);
    }
}
