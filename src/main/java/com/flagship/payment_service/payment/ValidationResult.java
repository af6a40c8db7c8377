package com.flagship.payment_service.payment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of validating a payment request: valid, or rejected with a reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    boolean valid;
    String reason;

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean isRejected() {
        return !valid;
    }
}
