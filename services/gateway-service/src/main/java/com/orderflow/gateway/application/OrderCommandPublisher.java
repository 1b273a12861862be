package com.orderflow.gateway.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.common.kafka.producer.EventProducer;
import com.orderflow.contracts.Topics;
import com.orderflow.contracts.events.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class OrderCommandPublisher {

    private static final Logger log = LoggerFactory.getLogger(OrderCommandPublisher.class);

    private final EventProducer producer;
    private final ObjectMapper objectMapper;
    private final DeliveryMode deliveryMode;

    public OrderCommandPublisher(EventProducer producer,
                                 ObjectMapper objectMapper,
                                 @Value("${gateway.orders.delivery-mode:MANUAL}") DeliveryMode deliveryMode) {
        this.producer = producer;
        this.objectMapper = objectMapper;
        this.deliveryMode = deliveryMode;
    }

    public DeliveryOutcome create(OrderEvent event) {
        return publish(Topics.ORDER_CREATE, event);
    }

    public DeliveryOutcome update(OrderEvent event) {
        return publish(Topics.ORDER_UPDATE, event);
    }

    public DeliveryOutcome delete(long orderId) {
        return publish(Topics.ORDER_DELETE, OrderEvent.deletion(orderId));
    }

    private DeliveryOutcome publish(String topic, OrderEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize order event topic={} orderId={}", topic, event.id(), e);
            return DeliveryOutcome.failed(topic, null, "Failed to serialize order event: " + e.getOriginalMessage());
        }
        String key = String.valueOf(event.id());
        DeliveryOutcome outcome = deliveryMode == DeliveryMode.BROKER
                ? producer.send(topic, key, payload)
                : producer.send(topic, key, payload, null);
        if (outcome.isSuccess()) {
            log.debug("Order event published topic={} orderId={} partition={} offset={}",
                    topic, event.id(), outcome.partition(), outcome.offset());
        } else {
            log.warn("Order event not published topic={} orderId={} status={} error={}",
                    topic, event.id(), outcome.status(), outcome.errorMessage());
        }
        return outcome;
    }
}
