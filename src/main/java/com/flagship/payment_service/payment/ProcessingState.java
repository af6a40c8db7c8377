package com.flagship.payment_service.payment;

import java.util.Locale;

/**
 * Stages a payment request passes through, in order.
 *
 * A request ends in DONE whenever the pipeline ran to its terminal event;
 * a request that failed earlier reports the stage it failed in.
 */
public enum ProcessingState {
    RECEIVED,
    VALIDATING,
    DECIDING,
    PERSISTING,
    PUBLISHING,
    DONE;

    /**
     * Lowercase form used in metric tags and log lines.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
