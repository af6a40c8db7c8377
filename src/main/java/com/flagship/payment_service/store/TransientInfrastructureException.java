package com.flagship.payment_service.store;

/**
 * Base type for failures of external infrastructure (state store, message bus)
 * that may succeed when tried again later.
 */
public class TransientInfrastructureException extends RuntimeException {

    public TransientInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
