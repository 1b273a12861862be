package com.orderflow.gateway.application;

/**
 * How order commands are produced.
 * {@code BROKER} leaves partitioning and retries to the Kafka client,
 * {@code MANUAL} picks partitions round-robin and retries in the application.
 */
public enum DeliveryMode {
    BROKER,
    MANUAL
}
