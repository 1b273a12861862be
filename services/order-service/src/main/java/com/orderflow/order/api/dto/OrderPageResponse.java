package com.orderflow.order.api.dto;

import com.orderflow.order.application.OrderPage;

import java.util.List;

public record OrderPageResponse(
        int pageNumber,
        int pageSize,
        int totalPages,
        int totalOrders,
        List<OrderResponse> orders
) {
    public static OrderPageResponse from(OrderPage page) {
        return new OrderPageResponse(page.pageNumber(), page.pageSize(), page.totalPages(), page.totalOrders(),
                page.orders().stream().map(OrderResponse::from).toList());
    }
}
