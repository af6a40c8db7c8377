package com.flagship.payment_service.config;

import com.flagship.payment_service.messaging.EventPublisher;
import com.flagship.payment_service.observability.PaymentMetrics;
import com.flagship.payment_service.payment.PaymentOutcomeStore;
import com.flagship.payment_service.payment.PaymentProcessor;
import com.flagship.payment_service.payment.PaymentValidator;
import com.flagship.payment_service.payment.decision.DecisionLatency;
import com.flagship.payment_service.payment.decision.PaymentDecisionGateway;
import com.flagship.payment_service.payment.decision.SimulatedPaymentDecisionGateway;
import com.flagship.payment_service.retry.RetryExecutor;
import com.flagship.payment_service.retry.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.random.RandomGenerator;

/**
 * Wires the payment processing pipeline from {@link PaymentProperties}.
 */
@Configuration
@EnableConfigurationProperties(PaymentProperties.class)
public class ProcessingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator decisionRandom() {
        return new Random();
    }

    @Bean
    public PaymentValidator paymentValidator() {
        return new PaymentValidator();
    }

    @Bean
    public PaymentDecisionGateway paymentDecisionGateway(PaymentProperties properties, RandomGenerator decisionRandom) {
        PaymentProperties.Decision decision = properties.getDecision();
        return new SimulatedPaymentDecisionGateway(
                decision.getApprovalThreshold(),
                decision.getApprovalProbability(),
                decisionRandom,
                DecisionLatency.fixed(decision.getLatency()));
    }

    /**
     * Threads that wait on the payment network, so a slow decision can be timed out and interrupted.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService decisionExecutor(PaymentProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getProcessing().getDecisionThreads(),
                new CustomizableThreadFactory("payment-decision-"));
    }

    @Bean
    public RetryExecutor publishRetryExecutor(PaymentProperties properties) {
        PaymentProperties.Publish publish = properties.getPublish();
        return new RetryExecutor(new RetryPolicy(publish.getMaxAttempts(), publish.getBaseDelay()));
    }

    @Bean
    public PaymentProcessor paymentProcessor(PaymentValidator paymentValidator,
                                             PaymentDecisionGateway paymentDecisionGateway,
                                             PaymentOutcomeStore paymentOutcomeStore,
                                             EventPublisher eventPublisher,
                                             RetryExecutor publishRetryExecutor,
                                             ExecutorService decisionExecutor,
                                             PaymentProperties properties,
                                             Clock clock,
                                             PaymentMetrics paymentMetrics) {
        return new PaymentProcessor(
                paymentValidator,
                paymentDecisionGateway,
                paymentOutcomeStore,
                eventPublisher,
                publishRetryExecutor,
                decisionExecutor,
                properties.getProcessing().getTimeout(),
                clock,
                paymentMetrics);
    }
}
