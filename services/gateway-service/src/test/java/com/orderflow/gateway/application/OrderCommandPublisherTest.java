package com.orderflow.gateway.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.common.kafka.producer.EventProducer;
import com.orderflow.contracts.events.OrderEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderCommandPublisherTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private final EventProducer producer = mock(EventProducer.class);

    private final OrderEvent event = new OrderEvent(42L, 7L, "Pending", BigDecimal.TEN,
            Instant.parse("2024-05-01T10:15:30Z"), List.of());

    @Test
    void brokerModeDelegatesPartitioningToClient() {
        when(producer.send(eq("order-create"), eq("42"), anyString()))
                .thenReturn(DeliveryOutcome.delivered("order-create", 1, 5L));
        OrderCommandPublisher publisher = new OrderCommandPublisher(producer, objectMapper, DeliveryMode.BROKER);

        DeliveryOutcome outcome = publisher.create(event);

        assertThat(outcome.isSuccess()).isTrue();
        verify(producer).send(eq("order-create"), eq("42"), contains("\"id\":42"));
        verify(producer, never()).send(anyString(), anyString(), anyString(), any());
    }

    @Test
    void manualModeLetsProducerPickPartition() {
        when(producer.send(eq("order-delete"), eq("42"), contains("\"id\":42"), isNull()))
                .thenReturn(DeliveryOutcome.delivered("order-delete", 3, 8L));
        OrderCommandPublisher publisher = new OrderCommandPublisher(producer, objectMapper, DeliveryMode.MANUAL);

        DeliveryOutcome outcome = publisher.delete(42);

        assertThat(outcome.partition()).isEqualTo(3);
    }
}
