package com.flagship.payment_service.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_service.messaging.EventSubscriber;
import com.flagship.payment_service.messaging.Topics;
import com.flagship.payment_service.observability.CorrelationContext;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Consumer for the order-created topic.
 *
 * Payments are requested by billing, not by the order itself, so orders are
 * only logged here. Unreadable messages are logged and skipped.
 */
@Component
@ConditionalOnProperty(name = "payment.consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OrderCreatedConsumer {

    private final EventSubscriber eventSubscriber;
    private final ObjectMapper objectMapper;

    private EventSubscriber.Subscription subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void subscribe() {
        subscription = eventSubscriber.subscribe(Topics.ORDER_CREATED, this::onMessage);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    /**
     * Handles one raw message from the order-created topic.
     *
     * @return The order, or empty if the payload could not be read
     */
    public Optional<OrderCreatedEvent> onMessage(String payload) {
        if (payload == null || payload.isBlank()) {
            log.warn("Skipping empty order-created message");
            return Optional.empty();
        }

        CorrelationContext.begin(null);
        try {
            OrderCreatedEvent order = objectMapper.readValue(payload, OrderCreatedEvent.class);
            log.info("Order created: order={}, customer={}, total={}",
                    order.getOrderId(), order.getCustomerId(), order.getTotalAmount());
            return Optional.of(order);

        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable order-created message: {}", e.getOriginalMessage());
            return Optional.empty();
        } finally {
            CorrelationContext.clear();
        }
    }
}
