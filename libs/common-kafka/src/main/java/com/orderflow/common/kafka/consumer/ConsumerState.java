package com.orderflow.common.kafka.consumer;

public enum ConsumerState {
    STARTING,
    POLLING,
    DISPATCHING,
    COMMITTING,
    STOPPING,
    STOPPED
}
