package com.orderflow.order.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record Order(
        Long id,
        Long userId,
        String status,
        BigDecimal netAmount,
        Instant orderDate,
        List<OrderItem> items,
        boolean deleted,
        long createdBy,
        Instant createdAt,
        Long modifiedBy,
        Instant modifiedAt
) {
    public Order {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public List<OrderItem> activeItems() {
        return items.stream().filter(item -> !item.deleted()).toList();
    }

    public Order withItems(List<OrderItem> newItems) {
        return new Order(id, userId, status, netAmount, orderDate, newItems, deleted,
                createdBy, createdAt, modifiedBy, modifiedAt);
    }

    public Order markDeleted(long actorUserId, Instant at) {
        return new Order(id, userId, status, netAmount, orderDate, items, true,
                createdBy, createdAt, actorUserId, at);
    }
}
