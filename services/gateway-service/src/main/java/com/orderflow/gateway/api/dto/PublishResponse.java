package com.orderflow.gateway.api.dto;

import com.orderflow.common.kafka.delivery.DeliveryOutcome;

public record PublishResponse(
        boolean success,
        String message,
        String topic,
        Integer partition,
        Long offset
) {

    public static PublishResponse from(DeliveryOutcome outcome) {
        String message = outcome.isSuccess() ? "Published" : outcome.errorMessage();
        return new PublishResponse(outcome.isSuccess(), message, outcome.topic(), outcome.partition(), outcome.offset());
    }

    public static PublishResponse invalid(String message) {
        return new PublishResponse(false, message, null, null, null);
    }
}
