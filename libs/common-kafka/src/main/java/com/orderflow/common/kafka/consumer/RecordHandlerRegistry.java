package com.orderflow.common.kafka.consumer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Topic name to handler mapping, filled by the consuming service at startup.
 */
public class RecordHandlerRegistry {

    private final Map<String, RecordHandler> handlers = new LinkedHashMap<>();

    public RecordHandlerRegistry register(String topic, RecordHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Handler topic must not be blank");
        }
        if (handlers.putIfAbsent(topic, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for topic " + topic);
        }
        return this;
    }

    public Optional<RecordHandler> find(String topic) {
        return Optional.ofNullable(handlers.get(topic));
    }

    public Set<String> topics() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
