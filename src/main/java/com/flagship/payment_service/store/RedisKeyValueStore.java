package com.flagship.payment_service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis-backed state store.
 *
 * Values are written as JSON strings with no expiry: outcomes are write-once
 * and have no deletion path. Conditional writes use SETNX, so the first
 * writer of a key wins. Connection and command failures surface as
 * {@link StateStoreException} so callers can fail fast.
 */
@Component
@ConditionalOnProperty(name = "payment.state-store.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void put(String key, Object value) {
        String json = serialize(key, value);
        try {
            redisTemplate.opsForValue().set(key, json);
            log.debug("Stored state: key={}", key);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to write key " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean putIfAbsent(String key, Object value) {
        String json = serialize(key, value);
        Boolean written;
        try {
            written = redisTemplate.opsForValue().setIfAbsent(key, json);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to write key " + key + ": " + e.getMessage(), e);
        }
        // null only inside a pipeline or transaction, which this store never opens
        if (written == null) {
            throw new StateStoreException("No reply to SETNX for key " + key, null);
        }
        log.debug("Conditional write: key={}, written={}", key, written);
        return written;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to read key " + key + ": " + e.getMessage(), e);
        }

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
}
