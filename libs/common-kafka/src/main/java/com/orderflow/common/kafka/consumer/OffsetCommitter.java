package com.orderflow.common.kafka.consumer;

import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.Map;

@FunctionalInterface
public interface OffsetCommitter {

    void commit(Map<TopicPartition, OffsetAndMetadata> offsets);
}
