package com.orderflow.common.kafka.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.function.Function;

/**
 * Reads the record value as JSON into {@code type} before handing it to {@code action}.
 * An unreadable payload is rejected without retry since it fails the same way every time.
 */
public class JsonRecordHandler<T> implements RecordHandler {

    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final Function<T, ProcessingOutcome> action;

    public JsonRecordHandler(ObjectMapper objectMapper, Class<T> type, Function<T, ProcessingOutcome> action) {
        this.objectMapper = objectMapper;
        this.type = type;
        this.action = action;
    }

    @Override
    public ProcessingOutcome handle(ConsumerRecord<String, String> record) {
        if (record.value() == null || record.value().isBlank()) {
            return ProcessingOutcome.rejected("Empty payload on topic " + record.topic());
        }
        T event;
        try {
            event = objectMapper.readValue(record.value(), type);
        } catch (JsonProcessingException e) {
            return ProcessingOutcome.rejected(
                    "Failed to deserialize " + type.getSimpleName() + " from topic " + record.topic()
                            + ": " + e.getOriginalMessage(), e);
        }
        if (event == null) {
            return ProcessingOutcome.rejected("Null " + type.getSimpleName() + " on topic " + record.topic());
        }
        return action.apply(event);
    }
}
