package com.flagship.payment_service.payment;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Inbound payment request, as published on the payment-request topic.
 *
 * The billing service sends camelCase fields with the invoice id as the
 * idempotency key; "id" and snake_case spellings are accepted as well.
 * A missing currency defaults to USD.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentRequest {

    public static final String DEFAULT_CURRENCY = "USD";

    @JsonProperty("invoiceId")
    @JsonAlias({"id", "invoice_id"})
    String id;

    @JsonProperty("orderId")
    @JsonAlias("order_id")
    String orderId;

    @JsonProperty("customerId")
    @JsonAlias("customer_id")
    String customerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("requestedBy")
    @JsonAlias("requested_by")
    String requestedBy;

    @JsonProperty("productId")
    @JsonAlias("product_id")
    String productId;

    public String getCurrency() {
        return currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
    }
}
