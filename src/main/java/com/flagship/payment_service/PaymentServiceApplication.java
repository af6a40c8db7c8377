package com.flagship.payment_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Payment service entry point.
 *
 * Consumes payment requests from the message bus, decides them, stores the
 * terminal outcome under the request's idempotency key and publishes the
 * result event.
 */
@SpringBootApplication
public class PaymentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentServiceApplication.class, args);
    }
}
