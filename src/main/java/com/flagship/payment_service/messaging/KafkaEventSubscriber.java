package com.flagship.payment_service.messaging;

import com.flagship.payment_service.config.PaymentProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Subscribes handlers to Kafka topics.
 *
 * Each subscription gets its own listener container with
 * payment.consumer.concurrency consumers. Offsets are committed per record,
 * after the handler returned, so a crash mid-handler leads to redelivery
 * rather than loss.
 */
@Component
@ConditionalOnProperty(name = "payment.messaging.type", havingValue = "kafka", matchIfMissing = true)
@Slf4j
public class KafkaEventSubscriber implements EventSubscriber {

    private final ConsumerFactory<String, String> consumerFactory;
    private final String groupId;
    private final int concurrency;
    private final List<ConcurrentMessageListenerContainer<String, String>> containers =
            new CopyOnWriteArrayList<>();

    public KafkaEventSubscriber(ConsumerFactory<String, String> consumerFactory,
                                PaymentProperties properties) {
        this.consumerFactory = consumerFactory;
        this.groupId = properties.getConsumer().getGroupId();
        this.concurrency = properties.getConsumer().getConcurrency();
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> handler) {
        ContainerProperties containerProperties = new ContainerProperties(topic);
        containerProperties.setGroupId(groupId);
        containerProperties.setAckMode(ContainerProperties.AckMode.RECORD);
        containerProperties.setMessageListener((MessageListener<String, String>) record -> deliver(record, handler));

        ConcurrentMessageListenerContainer<String, String> container =
                new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setConcurrency(concurrency);
        container.setBeanName("subscription-" + topic);
        container.start();
        containers.add(container);

        log.info("Subscribed to topic {} with group {} and {} consumers", topic, groupId, concurrency);

        return new KafkaSubscription(topic, container);
    }

    private void deliver(ConsumerRecord<String, String> record, Consumer<String> handler) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());
        handler.accept(record.value());
    }

    @PreDestroy
    public void stopAll() {
        containers.forEach(ConcurrentMessageListenerContainer::stop);
        containers.clear();
    }

    private final class KafkaSubscription implements Subscription {

        private final String topic;
        private final ConcurrentMessageListenerContainer<String, String> container;

        private KafkaSubscription(String topic, ConcurrentMessageListenerContainer<String, String> container) {
            this.topic = topic;
            this.container = container;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public void close() {
            container.stop();
            containers.remove(container);
            log.info("Unsubscribed from topic {}", topic);
        }
    }
}
