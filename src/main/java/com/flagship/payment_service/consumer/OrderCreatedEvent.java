package com.flagship.payment_service.consumer;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order placed by the order service, as received on order-created.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderCreatedEvent {

    @JsonAlias("order_id")
    String orderId;

    @JsonAlias("customer_id")
    String customerId;

    @JsonAlias("total_amount")
    BigDecimal totalAmount;

    @JsonAlias("created_at")
    Instant createdAt;
}
