package com.orderflow.order.domain;

import java.time.Instant;

/**
 * One row per order event the processor handled, redeliveries included.
 */
public record OrderEventLog(
        long orderId,
        OrderEventType type,
        long actorUserId,
        Instant createdAt
) {
}
