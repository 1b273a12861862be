package com.orderflow.common.kafka.producer;

import com.orderflow.common.kafka.delivery.DeliveryOutcome;

/**
 * Publishes string payloads to Kafka. Implementations are safe to call from many threads and
 * never throw for delivery problems; every call ends in a {@link DeliveryOutcome}.
 */
public interface EventProducer {

    /**
     * Single attempt at the API boundary. Partition choice and retries are left to the client
     * (idempotent producer, {@code retries}, {@code delivery.timeout.ms}).
     */
    DeliveryOutcome send(String topic, String key, String payload);

    /**
     * Explicit retry loop with backoff. Fatal errors abort immediately, retriable ones are retried
     * up to the configured bound.
     *
     * @param partition target partition, or {@code null} to pick one round-robin
     */
    DeliveryOutcome send(String topic, String key, String payload, Integer partition);

    /**
     * Next partition in round-robin order over the configured partition count.
     */
    int nextPartition();
}
