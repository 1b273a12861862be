package com.orderflow.common.kafka.consumer;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Single-threaded poll, dispatch and commit loop.
 *
 * <p>Every record is marked in the {@link OffsetTracker} once it was either processed or handed to
 * the DLQ, so the committed position never skips a record that has neither. Offsets are committed
 * manually, by batch size or by interval, and a last time on shutdown.
 */
public class EventConsumerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EventConsumerLoop.class);

    private final CommonKafkaProperties properties;
    private final Supplier<Consumer<String, String>> consumerFactory;
    private final ProcessingDispatcher dispatcher;
    private final DeadLetterRouter deadLetterRouter;
    private final OffsetTracker offsetTracker;
    private final CancellationSignal cancellation;
    private final KafkaDeliveryMetrics metrics;
    private final Set<String> subscribedTopics;

    private volatile Consumer<String, String> consumer;
    private volatile ConsumerState state = ConsumerState.STOPPED;
    private volatile boolean running;
    private long lastCommitAt;

    public EventConsumerLoop(CommonKafkaProperties properties,
                             Supplier<Consumer<String, String>> consumerFactory,
                             ProcessingDispatcher dispatcher,
                             DeadLetterRouter deadLetterRouter,
                             OffsetTracker offsetTracker,
                             CancellationSignal cancellation,
                             KafkaDeliveryMetrics metrics) {
        this.properties = properties;
        this.consumerFactory = consumerFactory;
        this.dispatcher = dispatcher;
        this.deadLetterRouter = deadLetterRouter;
        this.offsetTracker = offsetTracker;
        this.cancellation = cancellation;
        this.metrics = metrics;
        this.subscribedTopics = Set.copyOf(new HashSet<>(properties.getConsumer().getTopics()));
    }

    /**
     * Validates configuration, creates the consumer and subscribes.
     *
     * @throws IllegalArgumentException on invalid configuration; the loop is left {@code STOPPED}
     */
    public void start() {
        state = ConsumerState.STARTING;
        try {
            properties.validateConsumer();
            Consumer<String, String> created = consumerFactory.get();
            created.subscribe(properties.getConsumer().getTopics(), new PendingOffsetsRebalanceListener(created));
            consumer = created;
            running = true;
            lastCommitAt = System.currentTimeMillis();
            log.info("Kafka consumer started groupId={} topics={}",
                    properties.getConsumer().getGroupId(), properties.getConsumer().getTopics());
        } catch (RuntimeException e) {
            state = ConsumerState.STOPPED;
            log.error("Kafka consumer failed to start", e);
            throw e;
        }
    }

    @Override
    public void run() {
        if (consumer == null) {
            start();
        }
        try {
            while (running && !cancellation.isCancelled()) {
                try {
                    pollOnce();
                } catch (WakeupException | CancellationException e) {
                    if (!running || cancellation.isCancelled()) {
                        log.info("Kafka consumer loop cancelled");
                        break;
                    }
                    log.warn("Unexpected consumer interruption, continuing", e);
                } catch (KafkaException e) {
                    log.error("Kafka error in consumer loop, retrying in {} ms",
                            properties.getConsumer().getErrorBackoffMs(), e);
                    if (!backOff(properties.getConsumer().getErrorBackoffMs())) {
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected error in consumer loop", e);
                }
            }
        } finally {
            shutdown();
        }
    }

    void pollOnce() {
        state = ConsumerState.POLLING;
        ConsumerRecords<String, String> records =
                consumer.poll(Duration.ofMillis(properties.getConsumer().getPollTimeoutMs()));
        if (records.isEmpty()) {
            commitIfDue();
            cancellation.pause(properties.getConsumer().getIdleBackoffMs());
            return;
        }
        for (ConsumerRecord<String, String> record : records) {
            if (!running) {
                break;
            }
            state = ConsumerState.DISPATCHING;
            handle(record);
            commitIfDue();
        }
    }

    /**
     * Processes one record and marks its offset.
     *
     * @throws CancellationException if cancelled before the record was processed or dead-lettered
     */
    void handle(ConsumerRecord<String, String> record) {
        boolean mdc = properties.getLogging().isMdcEnabled();
        if (mdc) {
            MDC.put("topic", record.topic());
            MDC.put("partition", String.valueOf(record.partition()));
            MDC.put("offset", String.valueOf(record.offset()));
        }
        try {
            boolean recognized = subscribedTopics.contains(record.topic());
            ProcessingOutcome outcome = recognized
                    ? dispatcher.dispatch(record)
                    : ProcessingOutcome.rejected("Received message from unrecognized topic " + record.topic());

            if (outcome.success()) {
                metrics.incConsumerProcessed();
                log.debug("Processed message key={} message={}", record.key(), outcome.message());
            } else {
                metrics.incConsumerFailed();
                DeliveryOutcome dlqOutcome = deadLetterRouter.route(record, outcome, recognized);
                if (dlqOutcome.isCancelled()) {
                    throw new CancellationException("Cancelled while routing to DLQ");
                }
                if (!dlqOutcome.isSuccess()) {
                    log.error("DLQ publish failed, offset marked anyway key={} error={}",
                            record.key(), dlqOutcome.errorMessage());
                }
            }
            offsetTracker.markProcessed(record.topic(), record.partition(), record.offset());
        } finally {
            if (mdc) {
                MDC.remove("topic");
                MDC.remove("partition");
                MDC.remove("offset");
            }
        }
    }

    private void commitIfDue() {
        long now = System.currentTimeMillis();
        boolean batchFull = offsetTracker.size() >= properties.getConsumer().getBatchSize();
        boolean intervalElapsed = now - lastCommitAt >= properties.getConsumer().getCommitIntervalMs();
        if (!batchFull && !intervalElapsed) {
            return;
        }
        if (offsetTracker.size() > 0) {
            state = ConsumerState.COMMITTING;
            offsetTracker.flush(consumer::commitSync);
            state = ConsumerState.POLLING;
        }
        lastCommitAt = now;
    }

    private boolean backOff(long millis) {
        try {
            cancellation.pause(millis);
            return true;
        } catch (CancellationException e) {
            log.info("Kafka consumer loop cancelled during error backoff");
            return false;
        }
    }

    /**
     * Asks the loop to exit. Safe to call from any thread.
     */
    public void stop() {
        running = false;
        Consumer<String, String> current = consumer;
        if (current != null) {
            current.wakeup();
        }
    }

    private void shutdown() {
        state = ConsumerState.STOPPING;
        running = false;
        Consumer<String, String> current = consumer;
        if (current != null) {
            try {
                offsetTracker.flushOnShutdown(current::commitSync);
            } catch (RuntimeException e) {
                log.error("Final offset commit failed", e);
            }
            try {
                current.close(Duration.ofMillis(properties.getConsumer().getCloseTimeoutMs()));
            } catch (RuntimeException e) {
                log.error("Error closing Kafka consumer", e);
            }
            consumer = null;
        }
        try {
            deadLetterRouter.close();
        } catch (RuntimeException e) {
            log.error("Error closing DLQ producer", e);
        }
        state = ConsumerState.STOPPED;
        log.info("Kafka consumer stopped");
    }

    public ConsumerState state() {
        return state;
    }

    /**
     * Commits what was processed before partitions are handed to another member, then forgets them.
     * Runs on the polling thread, inside {@code poll}.
     */
    private final class PendingOffsetsRebalanceListener implements ConsumerRebalanceListener {

        private final Consumer<String, String> owner;

        private PendingOffsetsRebalanceListener(Consumer<String, String> owner) {
            this.owner = owner;
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            if (partitions.isEmpty()) {
                return;
            }
            log.info("Partitions revoked, committing pending offsets partitions={}", partitions);
            try {
                offsetTracker.flush(owner::commitSync);
            } finally {
                offsetTracker.forget(partitions);
            }
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            // already owned by someone else, a commit would be rejected
            log.warn("Partitions lost, dropping pending offsets partitions={}", partitions);
            offsetTracker.forget(partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Partitions assigned partitions={}", partitions);
        }
    }
}
