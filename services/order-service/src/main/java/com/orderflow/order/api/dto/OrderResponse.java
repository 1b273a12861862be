package com.orderflow.order.api.dto;

import com.orderflow.order.domain.Order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * An order as served over HTTP; deleted line items are left out.
 */
public record OrderResponse(
        Long id,
        Long userId,
        String status,
        BigDecimal netAmount,
        Instant orderDate,
        List<OrderItemResponse> items,
        Instant createdAt,
        Instant modifiedAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.id(),
                order.userId(),
                order.status(),
                order.netAmount(),
                order.orderDate(),
                order.activeItems().stream().map(OrderItemResponse::from).toList(),
                order.createdAt(),
                order.modifiedAt());
    }
}
