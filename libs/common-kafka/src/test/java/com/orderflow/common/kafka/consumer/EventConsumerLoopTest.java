package com.orderflow.common.kafka.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventConsumerLoopTest {

    private static final TopicPartition CREATE_0 = new TopicPartition("order-create", 0);

    private CommonKafkaProperties properties;
    private RecordingConsumer consumer;
    private KafkaTemplate<String, String> dlqTemplate;
    private CancellationSignal cancellation;
    private OffsetTracker tracker;
    private RecordHandlerRegistry registry;
    private AtomicInteger handled;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new CommonKafkaProperties();
        properties.setBootstrapServers("localhost:9092");
        properties.getConsumer().setGroupId("order-service");
        properties.getConsumer().setTopics(List.of("order-create", "order-update"));
        properties.getConsumer().setIdleBackoffMs(1);
        properties.getConsumer().setCommitIntervalMs(60_000);
        properties.getConsumer().setBatchSize(100);
        properties.getRetry().setInitialBackoffMs(1);
        properties.getDlq().setTopics(List.of("order-create-dlq", "order-update-dlq"));
        properties.getDlq().setCatchAllTopic("order-events-dlq");

        consumer = new RecordingConsumer();
        dlqTemplate = mock(KafkaTemplate.class);
        when(dlqTemplate.send(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            String topic = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 1, 1);
            return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, "v"), metadata));
        });
        cancellation = new CancellationSignal();
        handled = new AtomicInteger();
        registry = new RecordHandlerRegistry()
                .register("order-create", record -> {
                    handled.incrementAndGet();
                    return ProcessingOutcome.succeeded("created");
                })
                .register("order-update", record -> ProcessingOutcome.rejected("malformed"));
    }

    private EventConsumerLoop loop() {
        KafkaDeliveryMetrics metrics = new KafkaDeliveryMetrics(new SimpleMeterRegistry());
        tracker = new OffsetTracker(properties.getRetry(), cancellation, metrics);
        DeadLetterRouter router = new DeadLetterRouter(dlqTemplate, properties.getDlq(),
                new ObjectMapper().findAndRegisterModules(), cancellation, metrics);
        ProcessingDispatcher dispatcher = new ProcessingDispatcher(registry, properties.getRetry(), cancellation);
        return new EventConsumerLoop(properties, () -> consumer, dispatcher, router, tracker, cancellation, metrics);
    }

    private void assign(TopicPartition... partitions) {
        Map<TopicPartition, Long> beginning = new HashMap<>();
        for (TopicPartition tp : partitions) {
            beginning.put(tp, 0L);
        }
        consumer.updateBeginningOffsets(beginning);
        consumer.rebalance(List.of(partitions));
    }

    @Test
    void commitsWhenBatchIsFull() {
        properties.getConsumer().setBatchSize(1);
        EventConsumerLoop loop = loop();
        loop.start();
        assign(CREATE_0);
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 0L, "1", "{}"));
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 1L, "2", "{}"));

        loop.pollOnce();

        assertThat(handled).hasValue(2);
        assertThat(consumer.commits).containsEntry(CREATE_0, new OffsetAndMetadata(2));
        assertThat(tracker.size()).isZero();
    }

    @Test
    void offsetsWaitForIntervalOrBatch() {
        EventConsumerLoop loop = loop();
        loop.start();
        assign(CREATE_0);
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 0L, "1", "{}"));

        loop.pollOnce();

        assertThat(consumer.commits).isEmpty();
        assertThat(tracker.pending()).containsEntry(CREATE_0, 1L);
    }

    @Test
    void failedRecordIsDeadLetteredAndMarked() {
        EventConsumerLoop loop = loop();
        loop.start();
        TopicPartition update = new TopicPartition("order-update", 1);
        assign(update);
        consumer.addRecord(new ConsumerRecord<>("order-update", 1, 5L, "7", "{bad"));

        loop.pollOnce();

        verify(dlqTemplate, times(1)).send(eq("order-update-dlq"), eq("7"), anyString());
        assertThat(tracker.pending()).containsEntry(update, 6L);
    }

    @Test
    void unknownTopicGoesToCatchAllAndIsMarked() {
        EventConsumerLoop loop = loop();
        loop.start();

        loop.handle(new ConsumerRecord<>("unknown-topic", 2, 3L, "k", "payload"));

        verify(dlqTemplate, times(1)).send(eq("order-events-dlq"), eq("k"), anyString());
        verify(dlqTemplate, never()).send(eq("unknown-topic-dlq"), anyString(), anyString());
        assertThat(tracker.pending()).containsEntry(new TopicPartition("unknown-topic", 2), 4L);
        assertThat(handled).hasValue(0);
    }

    @Test
    void recordCancelledMidProcessingIsNotMarked() {
        EventConsumerLoop loop = loop();
        loop.start();
        cancellation.cancel();

        assertThatThrownBy(() -> loop.handle(new ConsumerRecord<>("order-create", 0, 0L, "1", "{}")))
                .isInstanceOf(CancellationException.class);
        assertThat(tracker.size()).isZero();
    }

    @Test
    void revokedPartitionIsCommittedBeforeHandOffAndThenForgotten() {
        properties.getConsumer().setBatchSize(2);
        TopicPartition create1 = new TopicPartition("order-create", 1);
        EventConsumerLoop loop = loop();
        loop.start();
        assign(CREATE_0, create1);
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 0L, "1", "{}"));
        loop.pollOnce();
        assertThat(consumer.history).isEmpty();

        consumer.rebalance(List.of(create1));

        assertThat(consumer.history).containsExactly(Map.of(CREATE_0, new OffsetAndMetadata(1)));
        assertThat(tracker.pending()).doesNotContainKey(CREATE_0);

        consumer.addRecord(new ConsumerRecord<>("order-create", 1, 0L, "2", "{}"));
        properties.getConsumer().setCommitIntervalMs(0);
        loop.pollOnce();

        assertThat(consumer.history).hasSize(2);
        assertThat(consumer.history.get(1)).containsOnlyKeys(create1);
        assertThat(tracker.size()).isZero();
    }

    @Test
    void invalidConfigurationStopsStartup() {
        properties.getConsumer().setTopics(List.of());
        EventConsumerLoop loop = loop();

        assertThatThrownBy(loop::start)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No Kafka topics specified in configuration.");
        assertThat(loop.state()).isEqualTo(ConsumerState.STOPPED);
    }

    @Test
    void runsOnLifecycleThreadAndCommitsOnShutdown() {
        EventConsumerLoop loop = loop();
        ConsumerLoopLifecycle lifecycle = new ConsumerLoopLifecycle(loop, cancellation, 5_000);
        lifecycle.start();
        assign(CREATE_0);
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 0L, "1", "{}"));
        consumer.addRecord(new ConsumerRecord<>("order-create", 0, 1L, "2", "{}"));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(handled).hasValue(2));
        assertThat(loop.state()).isIn(ConsumerState.POLLING, ConsumerState.DISPATCHING, ConsumerState.COMMITTING);

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(loop.state()).isEqualTo(ConsumerState.STOPPED);
        assertThat(consumer.closed()).isTrue();
        assertThat(consumer.commits).containsEntry(CREATE_0, new OffsetAndMetadata(2));
        verify(dlqTemplate).flush();
    }

    static class RecordingConsumer extends MockConsumer<String, String> {

        final Map<TopicPartition, OffsetAndMetadata> commits = new ConcurrentHashMap<>();
        final List<Map<TopicPartition, OffsetAndMetadata>> history = new CopyOnWriteArrayList<>();

        private ConsumerRebalanceListener listener;
        private boolean revokeDelivered;

        RecordingConsumer() {
            super(OffsetResetStrategy.EARLIEST);
        }

        @Override
        public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
            super.commitSync(offsets);
            commits.putAll(offsets);
            history.add(Map.copyOf(offsets));
        }

        @Override
        public synchronized void subscribe(Collection<String> topics, ConsumerRebalanceListener listener) {
            this.listener = listener;
            super.subscribe(topics, new ConsumerRebalanceListener() {
                @Override
                public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                    revokeDelivered = true;
                    listener.onPartitionsRevoked(partitions);
                }

                @Override
                public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                    listener.onPartitionsAssigned(partitions);
                }
            });
        }

        /**
         * Makes sure the revocation callback fires whether or not the client version invokes it here.
         */
        @Override
        public synchronized void rebalance(Collection<TopicPartition> newAssignment) {
            Set<TopicPartition> revoked = new HashSet<>(assignment());
            revoked.removeAll(newAssignment);
            revokeDelivered = false;
            super.rebalance(newAssignment);
            if (listener != null && !revokeDelivered && !revoked.isEmpty()) {
                listener.onPartitionsRevoked(revoked);
            }
        }
    }
}
