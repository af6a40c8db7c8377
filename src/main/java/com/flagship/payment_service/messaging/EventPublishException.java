package com.flagship.payment_service.messaging;

import com.flagship.payment_service.store.TransientInfrastructureException;

/**
 * Raised when the broker does not acknowledge a published event.
 */
public class EventPublishException extends TransientInfrastructureException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
