package com.orderflow.order.infrastructure;

public class DuplicateKeyException extends RuntimeException {

    private final long orderId;

    public DuplicateKeyException(long orderId) {
        super("Order " + orderId + " already exists");
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }
}
