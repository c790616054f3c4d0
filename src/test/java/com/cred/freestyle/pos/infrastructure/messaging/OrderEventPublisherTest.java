package com.cred.freestyle.pos.infrastructure.messaging;

import com.cred.freestyle.pos.infrastructure.messaging.events.OrderLifecycleEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderEventPublisher.
 * Tests payload, partition key and publish-after-commit behaviour.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderEventPublisher Unit Tests")
class OrderEventPublisherTest {

    private static final String TOPIC = "pos-order-events";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private OrderEventPublisher publisher;

    private OrderLifecycleEvent event;

    @BeforeEach
    void setUp() {
        publisher = new OrderEventPublisher(kafkaTemplate, new ObjectMapper().findAndRegisterModules(), TOPIC);
        event = new OrderLifecycleEvent(
                42L,
                OrderLifecycleEvent.EventType.ORDER_FINALIZED,
                "R1",
                new BigDecimal("200.00"),
                true,
                "7"
        );
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Should send immediately, keyed by order ID, outside a transaction")
    void publish_NoTransaction() {
        // Given
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        // When
        publisher.publish(event);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("42"), payload.capture());
        assertThat(payload.getValue())
                .contains("\"eventType\":\"ORDER_FINALIZED\"")
                .contains("\"receiptNumber\":\"R1\"")
                .contains("\"stockDeducted\":true");
    }

    @Test
    @DisplayName("Should hold the event until the transaction commits")
    void publish_AfterCommit() {
        // Given
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());
        TransactionSynchronizationManager.initSynchronization();

        // When
        publisher.publish(event);

        // Then
        verifyNoInteractions(kafkaTemplate);

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        verify(kafkaTemplate).send(eq(TOPIC), eq("42"), anyString());
    }

    @Test
    @DisplayName("Should never send when the transaction rolls back")
    void publish_RolledBack() {
        // Given
        TransactionSynchronizationManager.initSynchronization();

        // When
        publisher.publish(event);
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }

        // Then
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Broker failure is logged and not rethrown")
    void publish_SendFailure() {
        // Given
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // When / Then
        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
    }
}
