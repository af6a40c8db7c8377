package com.flagship.payment_service.health;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple liveness endpoint.
 * Unlike the Actuator health endpoint, this does not probe dependencies.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "payment-service";

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", SERVICE_NAME);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(response);
    }
}
