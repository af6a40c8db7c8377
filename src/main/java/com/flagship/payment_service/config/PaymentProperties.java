package com.flagship.payment_service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed configuration for payment processing, bound from the {@code payment.*} namespace.
 */
@ConfigurationProperties(prefix = "payment")
@Validated
@Getter
@Setter
public class PaymentProperties {

    @Valid
    private final Decision decision = new Decision();

    @Valid
    private final Processing processing = new Processing();

    @Valid
    private final Publish publish = new Publish();

    @Valid
    private final Consumer consumer = new Consumer();

    @Getter
    @Setter
    public static class Decision {
        /**
         * Amounts strictly below this threshold are always approved.
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal approvalThreshold = new BigDecimal("1000");

        /**
         * Probability of approval for amounts at or above the threshold.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double approvalProbability = 0.7;

        /**
         * Simulated latency of the external payment network. Zero disables it.
         */
        @NotNull
        private Duration latency = Duration.ZERO;
    }

    @Getter
    @Setter
    public static class Processing {
        /**
         * Upper bound for obtaining a decision before the request is failed with a timeout.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Threads available for concurrent decision calls.
         */
        @Min(1)
        private int decisionThreads = 16;
    }

    @Getter
    @Setter
    public static class Publish {
        /**
         * Attempts per published event, first attempt included.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Delay before attempt n+1 is baseDelay * n.
         */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Broker acknowledgment timeout for a single send.
         */
        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Consumer {
        /**
         * Whether the bus subscriptions are started at all.
         */
        private boolean enabled = true;

        /**
         * Consumer group used by the bus subscriptions.
         */
        private String groupId = "payment-service";

        /**
         * Concurrent consumers per subscribed topic.
         */
        @Min(1)
        private int concurrency = 3;
    }
}
