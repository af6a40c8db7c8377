package com.flagship.payment_service.payment;

import com.flagship.payment_service.payment.dto.ProcessPaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for payment operations.
 *
 * Key features:
 * - Runs a request through the same pipeline as bus-delivered requests
 * - Repeating a request id returns the stored outcome instead of deciding again
 * - Looks up stored outcomes by request id
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentProcessor paymentProcessor;
    private final PaymentOutcomeStore outcomeStore;

    /**
     * Processes a payment synchronously.
     *
     * @param request Payment request, same shape as on the payment-request topic
     * @return 200 with the outcome when one exists (approved or rejected),
     *         400 when validation failed, 422 for any other failure
     */
    @PostMapping("/process")
    public ResponseEntity<ProcessPaymentResponse> processPayment(@RequestBody PaymentRequest request) {
        log.info("Received payment processing request: id={}, amount={}", request.getId(), request.getAmount());

        ProcessingResult result = paymentProcessor.process(request);
        ProcessPaymentResponse body = ProcessPaymentResponse.from(result);

        if (result.hasOutcome()) {
            return ResponseEntity.ok(body);
        }
        if (result.isValidationFailure()) {
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    /**
     * Gets the stored outcome of a payment request.
     *
     * @param id Request id (idempotency key)
     * @return The outcome, or 404 if the request was never decided
     */
    @GetMapping("/{id}")
    public ResponseEntity<PaymentOutcome> getPayment(@PathVariable("id") String id) {
        return outcomeStore.find(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
