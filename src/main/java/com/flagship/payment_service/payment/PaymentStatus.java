package com.flagship.payment_service.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal status of a decided payment.
 *
 * Serialized in lower case ("approved", "rejected", "failed") as the other
 * services of the mesh expect.
 */
public enum PaymentStatus {
    /**
     * The payment network accepted the payment.
     */
    APPROVED,

    /**
     * The payment network declined the payment. A business outcome, not an error.
     */
    REJECTED,

    /**
     * The payment network answered but could not complete the payment.
     */
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PaymentStatus fromWireValue(String value) {
        return PaymentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
