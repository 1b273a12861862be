package com.orderflow.common.kafka.delivery;

public enum DeliveryStatus {
    DELIVERED,
    FAILED,
    CANCELLED
}
