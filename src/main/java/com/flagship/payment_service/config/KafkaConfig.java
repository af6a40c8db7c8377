package com.flagship.payment_service.config;

import com.flagship.payment_service.messaging.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics used by the payment service.
 *
 * Every topic uses 3 partitions; records are keyed by the payment request id
 * so all events of one request land on the same partition.
 */
@Configuration
@ConditionalOnProperty(name = "payment.messaging.type", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {

    private static final int PARTITIONS = 3;

    @Bean
    public NewTopic paymentRequestTopic() {
        return topic(Topics.PAYMENT_REQUEST);
    }

    @Bean
    public NewTopic paymentCompletedTopic() {
        return topic(Topics.PAYMENT_COMPLETED);
    }

    @Bean
    public NewTopic paymentFailedTopic() {
        return topic(Topics.PAYMENT_FAILED);
    }

    @Bean
    public NewTopic orderCreatedTopic() {
        return topic(Topics.ORDER_CREATED);
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }
}
