package com.orderflow.common.kafka.consumer;

import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Applies one record of a single topic. Thrown exceptions are treated as retryable failures.
 */
@FunctionalInterface
public interface RecordHandler {

    ProcessingOutcome handle(ConsumerRecord<String, String> record) throws Exception;
}
