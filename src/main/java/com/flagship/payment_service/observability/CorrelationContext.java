package com.flagship.payment_service.observability;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Correlation ids for log statements.
 *
 * The correlation id flows through:
 * - HTTP requests (from the X-Correlation-ID header or generated)
 * - consumed bus messages (generated per message)
 * - all log statements (via MDC)
 *
 * The request id of the payment being processed is kept in MDC as well.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Puts a correlation id in MDC, generating one if the given id is blank.
     *
     * @return The correlation id in effect
     */
    public static String begin(String correlationId) {
        String id = correlationId != null && !correlationId.isBlank()
                ? correlationId
                : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Removes everything this class put in MDC.
     * Should be called at the end of request or message processing.
     */
    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(REQUEST_ID_MDC_KEY);
    }

    public static void setRequestId(String requestId) {
        if (requestId != null) {
            MDC.put(REQUEST_ID_MDC_KEY, requestId);
        }
    }

    public static void clearRequestId() {
        MDC.remove(REQUEST_ID_MDC_KEY);
    }

    /**
     * Wraps a task so it runs with the MDC of the submitting thread.
     * The worker thread's previous MDC is restored afterwards.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> submitted = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            setContext(submitted);
            try {
                return task.call();
            } finally {
                setContext(previous);
            }
        };
    }

    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
