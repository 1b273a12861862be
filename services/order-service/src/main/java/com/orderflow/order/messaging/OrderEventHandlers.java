package com.orderflow.order.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.consumer.JsonRecordHandler;
import com.orderflow.common.kafka.consumer.RecordHandlerRegistry;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.contracts.Topics;
import com.orderflow.contracts.events.OrderEvent;
import com.orderflow.order.application.OrderProcessor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the order topics to the {@link OrderProcessor}. A fresh processor is taken from the
 * context for every record.
 */
@Configuration
public class OrderEventHandlers {

    @Bean
    public RecordHandlerRegistry recordHandlerRegistry(ObjectMapper objectMapper,
                                                       ObjectProvider<OrderProcessor> processors,
                                                       @Value("${order.consumer.actor-user-id:1}") long actorUserId) {
        return new RecordHandlerRegistry()
                .register(Topics.ORDER_CREATE, new JsonRecordHandler<>(objectMapper, OrderEvent.class,
                        event -> processors.getObject().createOrder(event, actorUserId)))
                .register(Topics.ORDER_UPDATE, new JsonRecordHandler<>(objectMapper, OrderEvent.class,
                        event -> processors.getObject().updateOrder(event, actorUserId)))
                .register(Topics.ORDER_DELETE, new JsonRecordHandler<>(objectMapper, OrderEvent.class,
                        event -> event.id() == null
                                ? ProcessingOutcome.rejected("Order id is required")
                                : processors.getObject().deleteOrder(event.id(), actorUserId)));
    }
}
