package com.flagship.payment_service.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_service.support.TestObjectMappers;
import com.flagship.payment_service.messaging.EventPublishException;
import com.flagship.payment_service.messaging.EventPublisher;
import com.flagship.payment_service.messaging.InMemoryEventBus;
import com.flagship.payment_service.messaging.Topics;
import com.flagship.payment_service.observability.CorrelationContext;
import com.flagship.payment_service.observability.PaymentMetrics;
import com.flagship.payment_service.payment.decision.DecisionLatency;
import com.flagship.payment_service.payment.decision.PaymentDecisionGateway;
import com.flagship.payment_service.payment.decision.SimulatedPaymentDecisionGateway;
import com.flagship.payment_service.payment.event.PaymentCompletedEvent;
import com.flagship.payment_service.payment.event.PaymentFailedEvent;
import com.flagship.payment_service.retry.RetryExecutor;
import com.flagship.payment_service.retry.RetryPolicy;
import com.flagship.payment_service.store.InMemoryKeyValueStore;
import com.flagship.payment_service.store.KeyValueStore;
import com.flagship.payment_service.store.StateStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the payment processing pipeline.
 *
 * These tests verify that:
 * - Every request ends with exactly one terminal event
 * - Invalid requests never reach the state store
 * - Redelivered requests reuse the stored outcome
 * - Store, publish, decision and timeout failures all end in payment-failed
 */
class PaymentProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = TestObjectMappers.paymentMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Long> retrySleeps = new ArrayList<>();

    private InMemoryKeyValueStore keyValueStore;
    private InMemoryEventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private PaymentMetrics metrics;
    private RetryExecutor retryExecutor;
    private ExecutorService decisionExecutor;

    @BeforeEach
    void setUp() {
        keyValueStore = new InMemoryKeyValueStore(objectMapper);
        eventBus = new InMemoryEventBus(objectMapper);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new PaymentMetrics(meterRegistry);
        retryExecutor = new RetryExecutor(new RetryPolicy(3, Duration.ofMillis(10)), retrySleeps::add);
        decisionExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        decisionExecutor.shutdownNow();
    }

    private static RandomGenerator draws(double value) {
        return new RandomGenerator() {
            @Override
            public long nextLong() {
                return 0;
            }

            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    private static PaymentDecisionGateway simulated(double draw) {
        return new SimulatedPaymentDecisionGateway(new BigDecimal("1000"), 0.7, draws(draw), DecisionLatency.none());
    }

    private PaymentProcessor processor(PaymentDecisionGateway gateway) {
        return processor(gateway, keyValueStore, eventBus, TIMEOUT);
    }

    private PaymentProcessor processor(PaymentDecisionGateway gateway, KeyValueStore store,
                                       EventPublisher publisher, Duration timeout) {
        return new PaymentProcessor(
                new PaymentValidator(),
                gateway,
                new PaymentOutcomeStore(store),
                publisher,
                retryExecutor,
                decisionExecutor,
                timeout,
                clock,
                metrics);
    }

    private static PaymentRequest request(String id, String amount) {
        return PaymentRequest.builder()
                .id(id)
                .orderId("ord-" + id)
                .customerId("cust-1")
                .productId("prod-1")
                .amount(new BigDecimal(amount))
                .build();
    }

    private JsonNode onlyEvent(String topic) throws Exception {
        List<InMemoryEventBus.PublishedEvent> events = eventBus.publishedTo(topic);
        assertEquals(1, events.size(), "expected exactly one event on " + topic);
        return objectMapper.readTree(events.get(0).payload());
    }

    @Test
    @DisplayName("Amount below threshold is approved, stored and announced on payment-completed")
    void approvedPayment() throws Exception {
        ProcessingResult result = processor(simulated(0.99)).process(request("inv-1", "250.00"));

        assertTrue(result.isSuccess());
        assertEquals(ProcessingState.DONE, result.getStage());
        assertTrue(result.isEventPublished());
        assertFalse(result.isDuplicate());
        assertInstanceOf(PaymentCompletedEvent.class, result.getEvent());

        PaymentOutcome stored = keyValueStore.get("payment-inv-1", PaymentOutcome.class).orElseThrow();
        assertEquals(PaymentStatus.APPROVED, stored.getStatus());
        assertEquals("Payment processed successfully", stored.getMessage());
        assertEquals(NOW, stored.getProcessedAt());

        JsonNode event = onlyEvent(Topics.PAYMENT_COMPLETED);
        assertEquals("inv-1", event.get("invoice_id").asText());
        assertEquals("ord-inv-1", event.get("order_id").asText());
        assertEquals(stored.getTransactionId(), event.get("transaction_id").asText());
        assertEquals("completed", event.get("status").asText());
        assertEquals("USD", event.get("currency").asText());
        assertTrue(eventBus.publishedTo(Topics.PAYMENT_FAILED).isEmpty());
    }

    @Test
    @DisplayName("High amount with unlucky draw is rejected and announced on payment-failed")
    void rejectedPayment() throws Exception {
        ProcessingResult result = processor(simulated(0.95)).process(request("inv-2", "5000"));

        assertFalse(result.isSuccess());
        assertTrue(result.hasOutcome());
        assertEquals(ProcessingState.DONE, result.getStage());
        assertEquals(PaymentFailedEvent.REJECTED_REASON, result.getFailureReason());

        PaymentOutcome stored = keyValueStore.get("payment-inv-2", PaymentOutcome.class).orElseThrow();
        assertEquals(PaymentStatus.REJECTED, stored.getStatus());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals(PaymentFailedEvent.REJECTED_REASON, event.get("reason").asText());
        assertEquals(PaymentFailedEvent.REJECTED_DETAILS, event.get("error_details").asText());
        assertEquals(stored.getTransactionId(), event.get("transaction_id").asText());
        assertEquals("failed", event.get("status").asText());
        assertTrue(eventBus.publishedTo(Topics.PAYMENT_COMPLETED).isEmpty());
    }

    @Test
    @DisplayName("High amount with lucky draw is approved")
    void highAmountApproved() {
        ProcessingResult result = processor(simulated(0.2)).process(request("inv-3", "5000"));

        assertTrue(result.isSuccess());
        assertEquals(1, eventBus.publishedTo(Topics.PAYMENT_COMPLETED).size());
    }

    @Test
    @DisplayName("FAILED decision is stored and announced with the processor failure reason")
    void failedDecision() throws Exception {
        ProcessingResult result = processor(r -> PaymentStatus.FAILED).process(request("inv-4", "10"));

        assertFalse(result.isSuccess());
        assertEquals(PaymentStatus.FAILED, result.getOutcome().getStatus());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals(PaymentFailedEvent.FAILED_REASON, event.get("reason").asText());
    }

    @Test
    @DisplayName("Invalid request publishes payment-failed without touching the store")
    void invalidRequest_noStoreAccess() throws Exception {
        KeyValueStore store = mock(KeyValueStore.class);
        AtomicInteger decisions = new AtomicInteger();
        PaymentDecisionGateway gateway = r -> {
            decisions.incrementAndGet();
            return PaymentStatus.APPROVED;
        };

        ProcessingResult result = processor(gateway, store, eventBus, TIMEOUT)
                .process(request("inv-5", "0"));

        assertFalse(result.isSuccess());
        assertTrue(result.isValidationFailure());
        assertEquals(PaymentValidator.AMOUNT_NOT_POSITIVE, result.getFailureReason());
        verifyNoInteractions(store);
        assertEquals(0, decisions.get());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("amount must be greater than zero", event.get("reason").asText());
        assertEquals("Payment validation failed: amount must be greater than zero",
                event.get("error_details").asText());
        assertEquals("inv-5", event.get("invoice_id").asText());
    }

    @Test
    @DisplayName("Request without id falls back to the order id in the failure event")
    void missingId_fallsBackToOrderId() throws Exception {
        PaymentRequest noId = request("x", "10").toBuilder().id(null).orderId("ord-77").build();

        ProcessingResult result = processor(simulated(0.1)).process(noId);

        assertEquals(PaymentValidator.ID_REQUIRED, result.getFailureReason());
        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("ord-77", event.get("invoice_id").asText());
        assertEquals("ord-77", event.get("order_id").asText());
        assertEquals(0, keyValueStore.size());
    }

    @Test
    @DisplayName("Approved request announces its amount and customer on payment-completed")
    void approvedEventCarriesAmount() throws Exception {
        PaymentRequest request = PaymentRequest.builder()
                .id("inv-1")
                .amount(new BigDecimal("500"))
                .customerId("c1")
                .build();

        ProcessingResult result = processor(simulated(0.99)).process(request);

        assertTrue(result.isSuccess());
        PaymentOutcome stored = keyValueStore.get("payment-inv-1", PaymentOutcome.class).orElseThrow();
        assertEquals("inv-1", stored.getId());
        assertEquals(PaymentStatus.APPROVED, stored.getStatus());

        JsonNode event = onlyEvent(Topics.PAYMENT_COMPLETED);
        assertEquals(0, new BigDecimal("500").compareTo(event.get("amount").decimalValue()));
        assertEquals("c1", event.get("customer_id").asText());
        assertEquals("inv-1", event.get("invoice_id").asText());
    }

    @Test
    @DisplayName("Empty id is rejected with 'id required' and nothing is written")
    void emptyId_rejectedWithoutStoreWrite() throws Exception {
        KeyValueStore store = mock(KeyValueStore.class);
        PaymentRequest request = PaymentRequest.builder()
                .id("")
                .amount(new BigDecimal("500"))
                .build();

        ProcessingResult result = processor(simulated(0.1), store, eventBus, TIMEOUT).process(request);

        assertFalse(result.isSuccess());
        assertTrue(result.isValidationFailure());
        assertEquals("id required", result.getFailureReason());
        verifyNoInteractions(store);

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("id required", event.get("reason").asText());
        assertTrue(eventBus.publishedTo(Topics.PAYMENT_COMPLETED).isEmpty());
    }

    @Test
    @DisplayName("Concurrent deliveries of one id settle on a single outcome")
    void concurrentDeliveries_shareOneOutcome() throws Exception {
        CountDownLatch bothDeciding = new CountDownLatch(2);
        AtomicInteger calls = new AtomicInteger();
        PaymentDecisionGateway racing = r -> {
            PaymentStatus status = calls.getAndIncrement() == 0 ? PaymentStatus.APPROVED : PaymentStatus.REJECTED;
            bothDeciding.countDown();
            assertTrue(bothDeciding.await(5, TimeUnit.SECONDS));
            return status;
        };
        PaymentProcessor processor = processor(racing);
        PaymentRequest request = request("inv-dup", "5000");

        ExecutorService deliveries = Executors.newFixedThreadPool(2);
        try {
            Future<ProcessingResult> a = deliveries.submit(() -> processor.process(request));
            Future<ProcessingResult> b = deliveries.submit(() -> processor.process(request));
            ProcessingResult first = a.get(10, TimeUnit.SECONDS);
            ProcessingResult second = b.get(10, TimeUnit.SECONDS);

            assertEquals(2, calls.get());
            PaymentOutcome stored = keyValueStore.get("payment-inv-dup", PaymentOutcome.class).orElseThrow();
            assertEquals(stored, first.getOutcome());
            assertEquals(stored, second.getOutcome());
            assertTrue(first.isDuplicate() ^ second.isDuplicate());
            assertEquals(1, keyValueStore.size());

            int completed = eventBus.publishedTo(Topics.PAYMENT_COMPLETED).size();
            int failed = eventBus.publishedTo(Topics.PAYMENT_FAILED).size();
            if (stored.isApproved()) {
                assertEquals(2, completed);
                assertEquals(0, failed);
            } else {
                assertEquals(0, completed);
                assertEquals(2, failed);
            }
        } finally {
            deliveries.shutdownNow();
        }
    }

    @Test
    @DisplayName("Interrupted request still publishes its failure event, then keeps the interrupt")
    void interruptedWhileDeciding() throws Exception {
        CountDownLatch deciding = new CountDownLatch(1);
        PaymentDecisionGateway blocking = r -> {
            deciding.countDown();
            Thread.sleep(30_000);
            return PaymentStatus.APPROVED;
        };
        AtomicBoolean interruptedWhilePublishing = new AtomicBoolean(true);
        EventPublisher publisher = (topic, key, event) -> {
            interruptedWhilePublishing.set(Thread.currentThread().isInterrupted());
            eventBus.publish(topic, key, event);
        };
        PaymentProcessor processor = processor(blocking, keyValueStore, publisher, TIMEOUT);

        AtomicReference<ProcessingResult> result = new AtomicReference<>();
        AtomicBoolean interruptedAfter = new AtomicBoolean();
        Thread worker = new Thread(() -> {
            result.set(processor.process(request("inv-14", "10")));
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });
        worker.start();
        assertTrue(deciding.await(5, TimeUnit.SECONDS));
        worker.interrupt();
        worker.join(10_000);

        assertEquals("processing error: interrupted", result.get().getFailureReason());
        assertTrue(result.get().isEventPublished());
        assertFalse(interruptedWhilePublishing.get());
        assertTrue(interruptedAfter.get());
        assertEquals(1, eventBus.publishedTo(Topics.PAYMENT_FAILED).size());
    }

    @Test
    @DisplayName("Decision runs with the caller's correlation and request ids in MDC")
    void decisionThreadSeesMdc() {
        AtomicReference<String> correlationId = new AtomicReference<>();
        AtomicReference<String> requestId = new AtomicReference<>();
        PaymentDecisionGateway recording = r -> {
            correlationId.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            requestId.set(MDC.get(CorrelationContext.REQUEST_ID_MDC_KEY));
            return PaymentStatus.APPROVED;
        };

        CorrelationContext.begin("corr-15");
        try {
            processor(recording).process(request("inv-15", "10"));
        } finally {
            CorrelationContext.clear();
        }

        assertEquals("corr-15", correlationId.get());
        assertEquals("inv-15", requestId.get());
    }

    @Test
    @DisplayName("Redelivered request reuses the stored outcome and re-publishes its event")
    void duplicateRequest_reusesOutcome() throws Exception {
        AtomicInteger decisions = new AtomicInteger();
        PaymentDecisionGateway gateway = r -> {
            decisions.incrementAndGet();
            return PaymentStatus.APPROVED;
        };
        PaymentProcessor processor = processor(gateway);

        ProcessingResult first = processor.process(request("inv-6", "10"));
        ProcessingResult second = processor.process(request("inv-6", "10"));

        assertEquals(1, decisions.get());
        assertFalse(first.isDuplicate());
        assertTrue(second.isDuplicate());
        assertEquals(first.getOutcome().getTransactionId(), second.getOutcome().getTransactionId());
        assertEquals(1, keyValueStore.size());

        List<InMemoryEventBus.PublishedEvent> events = eventBus.publishedTo(Topics.PAYMENT_COMPLETED);
        assertEquals(2, events.size());
        assertEquals(events.get(0).payload(), events.get(1).payload());
        assertEquals(1.0, meterRegistry.counter("payment.duplicate_requests").count());
    }

    @Test
    @DisplayName("Store write failure ends in payment-failed and never in payment-completed")
    void storeWriteFailure() throws Exception {
        KeyValueStore store = mock(KeyValueStore.class);
        when(store.get(anyString(), eq(PaymentOutcome.class))).thenReturn(Optional.empty());
        when(store.putIfAbsent(anyString(), any())).thenThrow(new StateStoreException("redis unavailable", null));

        ProcessingResult result = processor(r -> PaymentStatus.APPROVED, store, eventBus, TIMEOUT)
                .process(request("inv-7", "10"));

        assertFalse(result.isSuccess());
        assertFalse(result.hasOutcome());
        assertEquals(ProcessingState.PERSISTING, result.getStage());
        assertEquals("processing error: redis unavailable", result.getFailureReason());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("StateStoreException during persisting", event.get("error_details").asText());
        assertTrue(eventBus.publishedTo(Topics.PAYMENT_COMPLETED).isEmpty());
        assertEquals(1.0, meterRegistry.counter("payment.failures", "stage", "persisting").count());
    }

    @Test
    @DisplayName("Store read failure is reported from the deciding stage")
    void storeReadFailure() {
        KeyValueStore store = mock(KeyValueStore.class);
        when(store.get(anyString(), eq(PaymentOutcome.class)))
                .thenThrow(new StateStoreException("connection refused", null));

        ProcessingResult result = processor(r -> PaymentStatus.APPROVED, store, eventBus, TIMEOUT)
                .process(request("inv-8", "10"));

        assertEquals(ProcessingState.DECIDING, result.getStage());
        assertEquals("processing error: connection refused", result.getFailureReason());
        verify(store, never()).putIfAbsent(anyString(), any());
    }

    @Test
    @DisplayName("Publish failing every attempt leaves a terminal result with eventPublished=false")
    void publishExhausted() {
        EventPublisher publisher = mock(EventPublisher.class);
        doThrow(new EventPublishException("broker down", null))
                .when(publisher).publish(anyString(), anyString(), any());

        ProcessingResult result = processor(r -> PaymentStatus.APPROVED, keyValueStore, publisher, TIMEOUT)
                .process(request("inv-9", "10"));

        assertTrue(result.isSuccess());
        assertEquals(ProcessingState.DONE, result.getStage());
        assertFalse(result.isEventPublished());
        verify(publisher, times(3)).publish(eq(Topics.PAYMENT_COMPLETED), eq("inv-9"), any());
        assertEquals(List.of(10L, 20L), retrySleeps);
        assertTrue(keyValueStore.containsKey("payment-inv-9"));
        assertEquals(1.0, meterRegistry.counter("payment.publish.exhausted", "topic", Topics.PAYMENT_COMPLETED).count());
    }

    @Test
    @DisplayName("Publish succeeding on a retry counts as published")
    void publishRecoversOnRetry() {
        EventPublisher publisher = mock(EventPublisher.class);
        doThrow(new EventPublishException("leader election", null))
                .doNothing()
                .when(publisher).publish(anyString(), anyString(), any());

        ProcessingResult result = processor(r -> PaymentStatus.APPROVED, keyValueStore, publisher, TIMEOUT)
                .process(request("inv-10", "10"));

        assertTrue(result.isEventPublished());
        verify(publisher, times(2)).publish(anyString(), anyString(), any());
        assertEquals(List.of(10L), retrySleeps);
    }

    @Test
    @DisplayName("Decision slower than the timeout is cancelled and reported as a timeout")
    void decisionTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        PaymentDecisionGateway slow = r -> {
            try {
                Thread.sleep(30_000);
                return PaymentStatus.APPROVED;
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        };

        ProcessingResult result = processor(slow, keyValueStore, eventBus, Duration.ofMillis(100))
                .process(request("inv-11", "10"));

        assertFalse(result.isSuccess());
        assertEquals(ProcessingState.DECIDING, result.getStage());
        assertEquals("processing timeout: no decision within 100ms", result.getFailureReason());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "decision task should be interrupted");
        assertEquals(0, keyValueStore.size());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("processing timeout: no decision within 100ms", event.get("reason").asText());
    }

    @Test
    @DisplayName("Gateway error is converted into a processing error event")
    void gatewayError() throws Exception {
        PaymentDecisionGateway broken = r -> {
            throw new IllegalStateException("network down");
        };

        ProcessingResult result = processor(broken).process(request("inv-12", "10"));

        assertEquals("processing error: network down", result.getFailureReason());
        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("IllegalStateException during deciding", event.get("error_details").asText());
        assertEquals(0, keyValueStore.size());
    }

    @Test
    @DisplayName("Malformed payload is answered with an anonymous payment-failed event")
    void malformedPayload() throws Exception {
        ProcessingResult result = processor(simulated(0.1)).rejectMalformed("Unexpected character ('x')");

        assertFalse(result.isSuccess());
        assertEquals(ProcessingState.RECEIVED, result.getStage());
        assertTrue(result.isEventPublished());

        JsonNode event = onlyEvent(Topics.PAYMENT_FAILED);
        assertEquals("malformed payment request", event.get("reason").asText());
        assertEquals("unknown", event.get("invoice_id").asText());
        assertEquals("unknown", event.get("customer_id").asText());
        assertEquals(0, event.get("amount").asInt());
    }

    @Test
    @DisplayName("Request id is removed from MDC after processing")
    void mdcCleared() {
        processor(simulated(0.1)).process(request("inv-13", "10"));

        assertNull(MDC.get(CorrelationContext.REQUEST_ID_MDC_KEY));
    }
}
