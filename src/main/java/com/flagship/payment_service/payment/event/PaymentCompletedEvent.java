package com.flagship.payment_service.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_service.messaging.Topics;
import com.flagship.payment_service.payment.PaymentOutcome;
import com.flagship.payment_service.payment.PaymentRequest;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published on payment-completed when a payment was approved.
 */
@Value
public class PaymentCompletedEvent implements PaymentEvent {

    public static final String STATUS = "completed";

    @JsonProperty("invoice_id")
    String invoiceId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("status")
    public String getStatus() {
        return STATUS;
    }

    @Override
    @JsonIgnore
    public String getTopic() {
        return Topics.PAYMENT_COMPLETED;
    }

    /**
     * Creates the event for an approved outcome of a request.
     */
    public static PaymentCompletedEvent from(PaymentRequest request, PaymentOutcome outcome) {
        return new PaymentCompletedEvent(
            request.getId(),
            request.getOrderId(),
            outcome.getTransactionId(),
            request.getAmount(),
            request.getCurrency(),
            request.getCustomerId(),
            outcome.getProcessedAt()
        );
    }
}
