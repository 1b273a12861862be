package com.orderflow.gateway.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Body of create and update calls. {@code id} is required on create; on update the path id wins.
 */
public record OrderRequest(
        @Positive Long id,
        @NotBlank String status,
        @PositiveOrZero BigDecimal netAmount,
        Instant orderDate,
        List<@Valid OrderItemRequest> items
) {
}
