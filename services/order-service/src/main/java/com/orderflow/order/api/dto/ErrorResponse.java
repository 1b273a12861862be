package com.orderflow.order.api.dto;

public record ErrorResponse(String message) {
}
