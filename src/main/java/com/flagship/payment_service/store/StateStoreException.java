package com.flagship.payment_service.store;

/**
 * Raised when the state store cannot be read or written.
 */
public class StateStoreException extends TransientInfrastructureException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
