package com.orderflow.gateway.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record OrderItemRequest(
        Long id,
        @NotNull Long productId,
        @Positive int quantity,
        @NotNull @PositiveOrZero BigDecimal unitPrice
) {
}
