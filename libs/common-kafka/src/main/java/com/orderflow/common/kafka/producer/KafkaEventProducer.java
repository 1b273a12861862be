package com.orderflow.common.kafka.producer;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.common.kafka.delivery.ProducerErrorClassifier;
import com.orderflow.common.kafka.delivery.ProducerErrorKind;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import com.orderflow.common.kafka.support.JitteredExponentialBackOff;
import com.orderflow.common.kafka.support.LinearBackOff;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.InterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class KafkaEventProducer implements EventProducer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventProducer.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final CommonKafkaProperties.Producer settings;
    private final ProducerErrorClassifier classifier;
    private final KafkaDeliveryMetrics metrics;
    private final CancellationSignal cancellation;
    private final BackOff backOff;

    // last partition handed out; -1 so the first call yields 0
    private final AtomicInteger partitionCounter;

    public KafkaEventProducer(KafkaTemplate<String, String> kafkaTemplate,
                              CommonKafkaProperties properties,
                              ProducerErrorClassifier classifier,
                              KafkaDeliveryMetrics metrics,
                              CancellationSignal cancellation) {
        this(kafkaTemplate, properties, classifier, metrics, cancellation, -1);
    }

    KafkaEventProducer(KafkaTemplate<String, String> kafkaTemplate,
                       CommonKafkaProperties properties,
                       ProducerErrorClassifier classifier,
                       KafkaDeliveryMetrics metrics,
                       CancellationSignal cancellation,
                       int lastPartition) {
        properties.validateProducer();
        this.partitionCounter = new AtomicInteger(lastPartition);
        this.kafkaTemplate = kafkaTemplate;
        this.settings = properties.getProducer();
        this.classifier = classifier;
        this.metrics = metrics;
        this.cancellation = cancellation;
        this.backOff = settings.getBackoff() == CommonKafkaProperties.BackoffMode.EXPONENTIAL_JITTER
                ? new JitteredExponentialBackOff(settings.getRetryBaseDelayMs(), settings.getMaxBackoffMs())
                : new LinearBackOff(settings.getRetryBaseDelayMs(), settings.getMaxBackoffMs());
        log.info("KafkaEventProducer initialized brokers={} totalPartitions={} maxRetries={} backoff={}",
                properties.getBootstrapServers(), settings.getTotalPartitions(), settings.getMaxRetries(),
                settings.getBackoff());
    }

    @Override
    public DeliveryOutcome send(String topic, String key, String payload) {
        if (isBlank(topic) || isBlank(key) || isBlank(payload)) {
            return DeliveryOutcome.failed(topic, null, "Topic, key and payload must not be empty");
        }
        if (cancellation.isCancelled()) {
            metrics.incProducerCancelled();
            return DeliveryOutcome.cancelled(topic, null);
        }
        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, payload)
                    .get(settings.getSendTimeoutMs(), TimeUnit.MILLISECONDS);
            return delivered(topic, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.incProducerCancelled();
            return DeliveryOutcome.cancelled(topic, null);
        } catch (Exception e) {
            if (isCancellation(e)) {
                metrics.incProducerCancelled();
                return DeliveryOutcome.cancelled(topic, null);
            }
            ProducerErrorKind kind = classifier.classify(e);
            metrics.incProducerFailed();
            log.warn("Kafka produce failed topic={} key={} kind={}", topic, key, kind, e);
            return DeliveryOutcome.failed(topic, null, "Kafka error (" + kind + "): " + classifier.describe(e));
        }
    }

    @Override
    public DeliveryOutcome send(String topic, String key, String payload, Integer partition) {
        if (isBlank(topic) || isBlank(key) || isBlank(payload)) {
            return DeliveryOutcome.failed(topic, partition, "Topic, key and payload must not be empty");
        }

        int selectedPartition = partition != null ? partition : nextPartition();
        int maxAttempts = Math.max(1, settings.getMaxRetries());
        BackOffExecution backOffExecution = backOff.start();
        String lastError = "";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                metrics.incProducerCancelled();
                return DeliveryOutcome.cancelled(topic, selectedPartition);
            }
            try {
                SendResult<String, String> result = kafkaTemplate.send(topic, selectedPartition, key, payload)
                        .get(settings.getSendTimeoutMs(), TimeUnit.MILLISECONDS);
                if (attempt > 1) {
                    log.info("Kafka produce succeeded after retry topic={} partition={} attempt={}",
                            topic, selectedPartition, attempt);
                }
                return delivered(topic, result);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.incProducerCancelled();
                return DeliveryOutcome.cancelled(topic, selectedPartition);
            } catch (Exception e) {
                if (isCancellation(e)) {
                    metrics.incProducerCancelled();
                    return DeliveryOutcome.cancelled(topic, selectedPartition);
                }
                ProducerErrorKind kind = classifier.classify(e);
                if (kind.isFatal()) {
                    metrics.incProducerFailed();
                    log.error("Fatal Kafka produce error topic={} partition={} key={} kind={}",
                            topic, selectedPartition, key, kind, e);
                    return DeliveryOutcome.failed(topic, selectedPartition,
                            "Fatal Kafka error (" + kind + "): " + classifier.describe(e));
                }
                lastError = classifier.describe(e);
                log.warn("Retriable Kafka produce error topic={} partition={} attempt={}/{} kind={} error={}",
                        topic, selectedPartition, attempt, maxAttempts, kind, lastError);
            }

            if (attempt < maxAttempts) {
                metrics.incProducerRetry();
                try {
                    cancellation.pause(backOffExecution.nextBackOff());
                } catch (CancellationException e) {
                    metrics.incProducerCancelled();
                    return DeliveryOutcome.cancelled(topic, selectedPartition);
                }
            }
        }

        metrics.incProducerFailed();
        log.error("Kafka produce gave up topic={} partition={} attempts={} lastError={}",
                topic, selectedPartition, maxAttempts, lastError);
        return DeliveryOutcome.failed(topic, selectedPartition, lastError);
    }

    @Override
    public int nextPartition() {
        int total = Math.max(1, settings.getTotalPartitions());
        return partitionCounter.updateAndGet(last -> last < 0 || last >= total - 1 ? 0 : last + 1);
    }

    @Override
    public void close() {
        try {
            kafkaTemplate.flush();
        } catch (Exception e) {
            log.warn("Error while flushing Kafka producer", e);
        }
        if (kafkaTemplate.getProducerFactory() instanceof DisposableBean disposable) {
            try {
                disposable.destroy();
            } catch (Exception e) {
                log.warn("Error while closing Kafka producer factory", e);
            }
        }
        log.info("Kafka event producer closed");
    }

    private DeliveryOutcome delivered(String topic, SendResult<String, String> result) {
        metrics.incProducerDelivered();
        RecordMetadata metadata = result.getRecordMetadata();
        return DeliveryOutcome.delivered(metadata.topic() != null ? metadata.topic() : topic,
                metadata.partition(), metadata.offset());
    }

    private static boolean isCancellation(Throwable e) {
        return e instanceof CancellationException
                || e instanceof InterruptException
                || e.getCause() instanceof InterruptedException;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
