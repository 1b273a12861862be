package com.orderflow.common.kafka.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class KafkaDeliveryMetrics {

    private final Counter producerDelivered;
    private final Counter producerFailed;
    private final Counter producerRetry;
    private final Counter producerCancelled;
    private final Counter consumerProcessed;
    private final Counter consumerFailed;
    private final Counter dlqPublished;
    private final Counter dlqFailed;
    private final Counter commitSuccess;
    private final Counter commitFailure;

    public KafkaDeliveryMetrics(MeterRegistry registry) {
        this.producerDelivered = Counter.builder("kafka.producer.delivered").register(registry);
        this.producerFailed = Counter.builder("kafka.producer.failed").register(registry);
        this.producerRetry = Counter.builder("kafka.producer.retry").register(registry);
        this.producerCancelled = Counter.builder("kafka.producer.cancelled").register(registry);
        this.consumerProcessed = Counter.builder("kafka.consumer.processed").register(registry);
        this.consumerFailed = Counter.builder("kafka.consumer.failed").register(registry);
        this.dlqPublished = Counter.builder("kafka.dlq.published").register(registry);
        this.dlqFailed = Counter.builder("kafka.dlq.failed").register(registry);
        this.commitSuccess = Counter.builder("kafka.consumer.commit.success").register(registry);
        this.commitFailure = Counter.builder("kafka.consumer.commit.failure").register(registry);
    }

    public void incProducerDelivered() { producerDelivered.increment(); }
    public void incProducerFailed() { producerFailed.increment(); }
    public void incProducerRetry() { producerRetry.increment(); }
    public void incProducerCancelled() { producerCancelled.increment(); }
    public void incConsumerProcessed() { consumerProcessed.increment(); }
    public void incConsumerFailed() { consumerFailed.increment(); }
    public void incDlqPublished() { dlqPublished.increment(); }
    public void incDlqFailed() { dlqFailed.increment(); }
    public void incCommitSuccess() { commitSuccess.increment(); }
    public void incCommitFailure() { commitFailure.increment(); }
}
