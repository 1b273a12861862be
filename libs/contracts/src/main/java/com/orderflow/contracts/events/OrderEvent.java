package com.orderflow.contracts.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Payload carried on the order-create, order-update and order-delete topics.
 * Delete events only need {@code id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderEvent(
        Long id,
        Long userId,
        String status,
        BigDecimal netAmount,
        Instant orderDate,
        List<OrderLineItem> items
) {
    public OrderEvent {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static OrderEvent deletion(long id) {
        return new OrderEvent(id, null, null, null, null, List.of());
    }
}
