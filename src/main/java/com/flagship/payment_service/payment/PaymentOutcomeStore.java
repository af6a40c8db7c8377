package com.flagship.payment_service.payment;

import com.flagship.payment_service.store.KeyValueStore;
import com.flagship.payment_service.store.StateStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stores payment outcomes in the state store under {@code payment-<id>}.
 *
 * Outcomes are written once: when two deliveries of the same request race,
 * the first write wins and the loser adopts the stored outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentOutcomeStore {

    static final String KEY_PREFIX = "payment-";

    private final KeyValueStore keyValueStore;

    /**
     * Stores the outcome unless one already exists for its id.
     *
     * @return The outcome now stored for the id: the given one, or the one that was there first
     */
    public PaymentOutcome saveIfAbsent(PaymentOutcome outcome) {
        String key = keyFor(outcome.getId());
        if (keyValueStore.putIfAbsent(key, outcome)) {
            log.debug("Saved payment outcome: id={}, status={}", outcome.getId(), outcome.getStatus());
            return outcome;
        }
        PaymentOutcome stored = keyValueStore.get(key, PaymentOutcome.class)
                .orElseThrow(() -> new StateStoreException("Outcome for " + outcome.getId()
                        + " was taken but cannot be read back", null));
        log.info("Outcome for {} was stored concurrently with status {}, discarding {}",
                outcome.getId(), stored.getStatus(), outcome.getStatus());
        return stored;
    }

    public Optional<PaymentOutcome> find(String requestId) {
        return keyValueStore.get(keyFor(requestId), PaymentOutcome.class);
    }

    static String keyFor(String requestId) {
        return KEY_PREFIX + requestId;
    }
}
