package com.orderflow.order.application;

import com.orderflow.order.domain.Order;

import java.util.List;

public record OrderPage(
        int pageNumber,
        int pageSize,
        int totalPages,
        int totalOrders,
        List<Order> orders
) {
    public OrderPage {
        orders = orders == null ? List.of() : List.copyOf(orders);
    }
}
