package com.flagship.payment_service.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process message bus for local runs and tests.
 *
 * Publishing serializes the event to JSON, keeps it in a per-topic log and
 * hands the payload to every subscriber of the topic on the publishing thread.
 * A subscriber that throws does not prevent delivery to the others and does
 * not fail the publish.
 */
@Component
@ConditionalOnProperty(name = "payment.messaging.type", havingValue = "memory")
@Slf4j
public class InMemoryEventBus implements EventPublisher, EventSubscriber {

    private final ObjectMapper objectMapper;
    private final Map<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();
    private final Map<String, List<PublishedEvent>> published = new ConcurrentHashMap<>();

    public InMemoryEventBus(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String topic, String key, Object event) {
        String payload = serialize(event);
        published.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add(new PublishedEvent(topic, key, payload));

        for (Consumer<String> handler : handlers.getOrDefault(topic, List.of())) {
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                log.error("Subscriber of topic {} failed: {}", topic, e.getMessage(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> handler) {
        handlers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(handler);
        return new Subscription() {
            @Override
            public String topic() {
                return topic;
            }

            @Override
            public void close() {
                handlers.getOrDefault(topic, List.of()).remove(handler);
            }
        };
    }

    /**
     * Everything published to a topic so far, oldest first.
     */
    public List<PublishedEvent> publishedTo(String topic) {
        return List.copyOf(published.getOrDefault(topic, List.of()));
    }

    public int subscriberCount(String topic) {
        return handlers.getOrDefault(topic, List.of()).size();
    }

    private String serialize(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }

    /**
     * A published message as it would travel on the wire.
     */
    public record PublishedEvent(String topic, String key, String payload) {}
}
