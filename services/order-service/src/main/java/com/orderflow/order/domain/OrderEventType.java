package com.orderflow.order.domain;

public enum OrderEventType {
    CREATE,
    UPDATE,
    DELETE
}
