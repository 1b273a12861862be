package com.orderflow.common.kafka.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import com.orderflow.contracts.events.DeadLetterEnvelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Publishes records that could not be processed to a dead-letter topic, wrapped in a
 * {@link DeadLetterEnvelope}. Records from recognized topics go to {@code <topic><suffix>} when
 * that topic is configured, everything else to the catch-all topic.
 */
public class DeadLetterRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

    private final KafkaTemplate<String, String> dlqTemplate;
    private final CommonKafkaProperties.Dlq dlq;
    private final ObjectMapper objectMapper;
    private final CancellationSignal cancellation;
    private final KafkaDeliveryMetrics metrics;
    private final Clock clock;

    public DeadLetterRouter(KafkaTemplate<String, String> dlqTemplate,
                            CommonKafkaProperties.Dlq dlq,
                            ObjectMapper objectMapper,
                            CancellationSignal cancellation,
                            KafkaDeliveryMetrics metrics) {
        this(dlqTemplate, dlq, objectMapper, cancellation, metrics, Clock.systemUTC());
    }

    DeadLetterRouter(KafkaTemplate<String, String> dlqTemplate,
                     CommonKafkaProperties.Dlq dlq,
                     ObjectMapper objectMapper,
                     CancellationSignal cancellation,
                     KafkaDeliveryMetrics metrics,
                     Clock clock) {
        this.dlqTemplate = dlqTemplate;
        this.dlq = dlq;
        this.objectMapper = objectMapper;
        this.cancellation = cancellation;
        this.metrics = metrics;
        this.clock = clock;
    }

    public String resolveTopic(String originalTopic, boolean recognized) {
        if (!recognized) {
            return dlq.getCatchAllTopic();
        }
        String candidate = originalTopic + dlq.getSuffix();
        if (dlq.getTopics().contains(candidate)) {
            return candidate;
        }
        log.warn("No DLQ topic configured for topic={}, using catch-all {}", originalTopic, dlq.getCatchAllTopic());
        return dlq.getCatchAllTopic();
    }

    /**
     * Never throws; failures come back as a failed outcome and are logged.
     */
    public DeliveryOutcome route(ConsumerRecord<String, String> record, ProcessingOutcome failure, boolean recognized) {
        String dlqTopic = resolveTopic(record.topic(), recognized);
        if (cancellation.isCancelled()) {
            return DeliveryOutcome.cancelled(dlqTopic, null);
        }

        DeadLetterEnvelope envelope = new DeadLetterEnvelope(
                record.topic(),
                record.value(),
                record.key(),
                failure.message(),
                failure.detail(),
                Instant.now(clock),
                record.partition(),
                record.offset());

        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            metrics.incDlqFailed();
            log.error("Failed to serialize DLQ envelope topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset(), e);
            return DeliveryOutcome.failed(dlqTopic, null, "Failed to serialize DLQ envelope: " + e.getOriginalMessage());
        }

        try {
            SendResult<String, String> result = dlqTemplate.send(dlqTopic, record.key(), json)
                    .get(dlq.getMessageTimeoutMs(), TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            metrics.incDlqPublished();
            log.warn("Routed message to DLQ topic={} partition={} offset={} dlqTopic={} reason={}",
                    record.topic(), record.partition(), record.offset(), dlqTopic, failure.message());
            return DeliveryOutcome.delivered(dlqTopic, metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryOutcome.cancelled(dlqTopic, null);
        } catch (Exception e) {
            metrics.incDlqFailed();
            log.error("Failed to publish to DLQ dlqTopic={} topic={} partition={} offset={}",
                    dlqTopic, record.topic(), record.partition(), record.offset(), e);
            return DeliveryOutcome.failed(dlqTopic, null, "Failed to publish to DLQ: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            dlqTemplate.flush();
        } catch (Exception e) {
            log.warn("Error while flushing DLQ producer", e);
        }
        if (dlqTemplate.getProducerFactory() instanceof DisposableBean disposable) {
            try {
                disposable.destroy();
            } catch (Exception e) {
                log.warn("Error while closing DLQ producer factory", e);
            }
        }
    }
}
