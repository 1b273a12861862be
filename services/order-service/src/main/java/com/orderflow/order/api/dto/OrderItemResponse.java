package com.orderflow.order.api.dto;

import com.orderflow.order.domain.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
        Long id,
        Long productId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal grossAmount
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(item.id(), item.productId(), item.quantity(), item.unitPrice(), item.grossAmount());
    }
}
