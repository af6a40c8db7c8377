package com.flagship.payment_service.store;

import java.util.Optional;

/**
 * Boundary to the external key/value state store.
 *
 * Values are stored as JSON. A {@code put} followed by a {@code get} on the
 * same key observes the written value. {@code put} is an upsert;
 * {@code putIfAbsent} is atomic and never replaces an existing value.
 *
 * Implementations report store unavailability as {@link StateStoreException}
 * and never retry on their own.
 */
public interface KeyValueStore {

    /**
     * Writes (or overwrites) the value stored under a key.
     *
     * @param key Store key
     * @param value Value to serialize and store
     * @throws StateStoreException if the store cannot be reached
     */
    void put(String key, Object value);

    /**
     * Writes the value only if nothing is stored under the key yet.
     *
     * @param key Store key
     * @param value Value to serialize and store
     * @return true if this call wrote the value, false if the key was already taken
     * @throws StateStoreException if the store cannot be reached
     */
    boolean putIfAbsent(String key, Object value);

    /**
     * Reads the value stored under a key.
     *
     * @param key Store key
     * @param type Type to deserialize into
     * @return The stored value, or empty if the key is absent
     * @throws StateStoreException if the store cannot be reached or the value is unreadable
     */
    <T> Optional<T> get(String key, Class<T> type);
}
