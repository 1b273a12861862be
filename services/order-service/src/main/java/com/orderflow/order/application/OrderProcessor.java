package com.orderflow.order.application;

import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.contracts.events.OrderEvent;

/**
 * Applies order events to storage and appends one event-log entry per handled event. Every
 * operation is safe to repeat: a redelivered create or delete reports success without changing the
 * stored order.
 */
public interface OrderProcessor {

    ProcessingOutcome createOrder(OrderEvent event, long userId);

    /**
     * An update for an order that is not stored yet fails retryably, since its create may still be
     * in flight on another partition.
     */
    ProcessingOutcome updateOrder(OrderEvent event, long userId);

    ProcessingOutcome deleteOrder(long orderId, long userId);
}
