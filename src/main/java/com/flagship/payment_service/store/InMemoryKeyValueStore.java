package com.flagship.payment_service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process state store for local runs and tests.
 *
 * Values go through the same JSON round trip as the Redis store so that
 * serialization problems show up without a running Redis.
 */
@Component
@ConditionalOnProperty(name = "payment.state-store.type", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ObjectMapper objectMapper;
    private final Map<String, String> entries = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(String key, Object value) {
        entries.put(key, serialize(key, value));
    }

    @Override
    public boolean putIfAbsent(String key, Object value) {
        return entries.putIfAbsent(key, serialize(key, value)) == null;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = entries.get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Unreadable value stored under key " + key, e);
        }
    }

    private String serialize(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value for key " + key, e);
        }
    }

    /**
     * Number of stored keys.
     */
    public int size() {
        return entries.size();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }
}
