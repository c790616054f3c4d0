package com.cred.freestyle.pos.infrastructure.messaging;

import com.cred.freestyle.pos.infrastructure.messaging.events.OrderLifecycleEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for order lifecycle events.
 *
 * Events raised inside a transaction are held back until it commits, so a
 * rolled-back sale or finalization is never announced. Publishing failures are
 * logged and do not affect the committed order.
 *
 * Topic partitioning: key is the order ID, so events of one order stay ordered.
 *
 * @author POS Team
 */
@Service
public class OrderEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public OrderEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${pos.events.topic:pos-order-events}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    /**
     * Publish an order lifecycle event, after commit when a transaction is active.
     *
     * @param event Lifecycle event
     */
    public void publish(OrderLifecycleEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
            return;
        }
        send(event);
    }

    private void send(OrderLifecycleEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} event for order {}", event.getEventType(), event.getOrderId(), e);
            return;
        }

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                topic,
                String.valueOf(event.getOrderId()),
                payload
        );

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Published {} event for order {}, partition: {}",
                        event.getEventType(), event.getOrderId(), result.getRecordMetadata().partition());
            } else {
                logger.error("Failed to publish {} event for order {}",
                        event.getEventType(), event.getOrderId(), ex);
            }
        });
    }
}
