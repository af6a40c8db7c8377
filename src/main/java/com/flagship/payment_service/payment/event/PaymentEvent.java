package com.flagship.payment_service.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Base interface for the terminal events published for a payment request.
 *
 * Every request produces exactly one of {@link PaymentCompletedEvent} or
 * {@link PaymentFailedEvent}.
 */
public interface PaymentEvent {

    /**
     * The invoice (request id) this event is about. Also used as the record key.
     */
    String getInvoiceId();

    String getTransactionId();

    /**
     * Topic the event is published to.
     */
    @JsonIgnore
    String getTopic();
}
