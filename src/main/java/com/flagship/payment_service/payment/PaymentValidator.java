package com.flagship.payment_service.payment;

import java.math.BigDecimal;

/**
 * Structural checks applied to every payment request before a decision is requested.
 *
 * Rules are applied in order and the first failure wins:
 * 1. the idempotency key (id) must be non-empty
 * 2. the amount must be greater than zero
 */
public class PaymentValidator {

    public static final String ID_REQUIRED = "id required";
    public static final String AMOUNT_NOT_POSITIVE = "amount must be greater than zero";

    public ValidationResult validate(PaymentRequest request) {
        if (request == null || request.getId() == null || request.getId().isBlank()) {
            return ValidationResult.rejected(ID_REQUIRED);
        }

        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            return ValidationResult.rejected(AMOUNT_NOT_POSITIVE);
        }

        return ValidationResult.valid();
    }
}
