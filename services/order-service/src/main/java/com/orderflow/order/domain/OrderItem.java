package com.orderflow.order.domain;

import java.math.BigDecimal;
import java.util.Objects;

public record OrderItem(
        Long id,
        Long productId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal grossAmount,
        boolean deleted
) {

    public static OrderItem of(Long id, Long productId, int quantity, BigDecimal unitPrice) {
        return new OrderItem(id, productId, quantity, unitPrice, gross(quantity, unitPrice), false);
    }

    public OrderItem withId(long newId) {
        return new OrderItem(newId, productId, quantity, unitPrice, grossAmount, deleted);
    }

    public OrderItem markDeleted() {
        return new OrderItem(id, productId, quantity, unitPrice, grossAmount, true);
    }

    /**
     * True if the requested line differs from this stored line in product, quantity or price.
     */
    public boolean differsFrom(OrderItem requested) {
        return quantity != requested.quantity
                || !Objects.equals(productId, requested.productId)
                || compare(unitPrice, requested.unitPrice) != 0;
    }

    private static int compare(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b ? 0 : 1;
        }
        return a.compareTo(b);
    }

    private static BigDecimal gross(int quantity, BigDecimal unitPrice) {
        return unitPrice == null ? BigDecimal.ZERO : unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
