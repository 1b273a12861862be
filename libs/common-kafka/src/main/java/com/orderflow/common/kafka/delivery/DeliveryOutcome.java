package com.orderflow.common.kafka.delivery;

/**
 * Result of one produce call. {@code partition} and {@code offset} are only known once the broker
 * acknowledged the record; a failed call may still carry the partition it targeted.
 */
public record DeliveryOutcome(
        DeliveryStatus status,
        String topic,
        Integer partition,
        Long offset,
        String errorMessage
) {

    public static DeliveryOutcome delivered(String topic, int partition, long offset) {
        return new DeliveryOutcome(DeliveryStatus.DELIVERED, topic, partition, offset, null);
    }

    public static DeliveryOutcome failed(String topic, Integer partition, String errorMessage) {
        return new DeliveryOutcome(DeliveryStatus.FAILED, topic, partition, null, errorMessage);
    }

    public static DeliveryOutcome cancelled(String topic, Integer partition) {
        return new DeliveryOutcome(DeliveryStatus.CANCELLED, topic, partition, null, "Operation cancelled");
    }

    public boolean isSuccess() {
        return status == DeliveryStatus.DELIVERED;
    }

    public boolean isCancelled() {
        return status == DeliveryStatus.CANCELLED;
    }
}
