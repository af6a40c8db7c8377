package com.flagship.payment_service.observability;

import com.flagship.payment_service.store.KeyValueStore;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.common.Node;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Custom health indicators for the payment service.
 *
 * These health checks determine if the service is ready to accept traffic.
 */
public class HealthIndicators {

    /**
     * Health indicator for the state store.
     * Writes a probe key and reads it back; the service cannot persist outcomes without it.
     */
    @Component("stateStoreHealth")
    public static class StateStoreHealthIndicator implements HealthIndicator {

        static final String PROBE_KEY = "health-probe";

        private final KeyValueStore keyValueStore;

        public StateStoreHealthIndicator(KeyValueStore keyValueStore) {
            this.keyValueStore = keyValueStore;
        }

        @Override
        public Health health() {
            try {
                String probe = Instant.now().toString();
                keyValueStore.put(PROBE_KEY, probe);
                Optional<String> readBack = keyValueStore.get(PROBE_KEY, String.class);

                if (readBack.isPresent() && probe.equals(readBack.get())) {
                    return Health.up()
                            .withDetail("store", keyValueStore.getClass().getSimpleName())
                            .build();
                }
                return Health.down()
                        .withDetail("error", "Probe value not read back")
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Health indicator for Kafka connectivity.
     * Asks the cluster for its brokers; DOWN when none answer within the timeout.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "payment.messaging.type", havingValue = "kafka", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        static final Duration CHECK_TIMEOUT = Duration.ofSeconds(3);

        private final Supplier<Admin> adminFactory;

        @Autowired
        public KafkaHealthIndicator(KafkaAdmin kafkaAdmin) {
            this(() -> AdminClient.create(kafkaAdmin.getConfigurationProperties()));
        }

        KafkaHealthIndicator(Supplier<Admin> adminFactory) {
            this.adminFactory = adminFactory;
        }

        @Override
        public Health health() {
            try (Admin admin = adminFactory.get()) {
                DescribeClusterResult cluster = admin.describeCluster(
                        new DescribeClusterOptions().timeoutMs((int) CHECK_TIMEOUT.toMillis()));
                Collection<Node> nodes = cluster.nodes().get(CHECK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

                if (nodes.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka brokers available")
                            .build();
                }
                return Health.up()
                        .withDetail("clusterId", cluster.clusterId().get(CHECK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
                        .withDetail("brokers", nodes.size())
                        .build();

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down()
                        .withDetail("error", "Interrupted while checking Kafka")
                        .build();
            } catch (Exception e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                return Health.down()
                        .withDetail("error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
