package com.orderflow.common.kafka.consumer;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Next offset to commit per partition. Values only move forward, and an entry is dropped only
 * once the exact value it held was committed.
 */
public class OffsetTracker {

    private static final Logger log = LoggerFactory.getLogger(OffsetTracker.class);

    private final ConcurrentHashMap<TopicPartition, Long> pending = new ConcurrentHashMap<>();
    private final CommonKafkaProperties.Retry retry;
    private final CancellationSignal cancellation;
    private final KafkaDeliveryMetrics metrics;

    public OffsetTracker(CommonKafkaProperties.Retry retry, CancellationSignal cancellation, KafkaDeliveryMetrics metrics) {
        this.retry = retry;
        this.cancellation = cancellation;
        this.metrics = metrics;
    }

    public void markProcessed(String topic, int partition, long offset) {
        pending.merge(new TopicPartition(topic, partition), offset + 1, Math::max);
    }

    /**
     * Drops pending offsets for partitions this member no longer owns.
     */
    public void forget(Collection<TopicPartition> partitions) {
        partitions.forEach(pending::remove);
    }

    public int size() {
        return pending.size();
    }

    public Map<TopicPartition, Long> pending() {
        return Collections.unmodifiableMap(new HashMap<>(pending));
    }

    /**
     * Commits a snapshot of the pending offsets, retrying with exponential backoff.
     *
     * @return {@code true} if nothing was pending or the commit went through
     */
    public boolean flush(OffsetCommitter committer) {
        return commit(committer, true);
    }

    /**
     * Last commit before the consumer closes. Retries without delay and ignores cancellation.
     */
    public boolean flushOnShutdown(OffsetCommitter committer) {
        return commit(committer, false);
    }

    private boolean commit(OffsetCommitter committer, boolean running) {
        Map<TopicPartition, Long> snapshot = new HashMap<>(pending);
        if (snapshot.isEmpty()) {
            return true;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        snapshot.forEach((tp, offset) -> offsets.put(tp, new OffsetAndMetadata(offset)));

        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        ExponentialBackOff exponential = new ExponentialBackOff(retry.getInitialBackoffMs(), retry.getMultiplier());
        exponential.setMaxInterval(retry.getMaxBackoffMs());
        BackOffExecution backOff = exponential.start();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                committer.commit(offsets);
                snapshot.forEach(pending::remove);
                metrics.incCommitSuccess();
                log.debug("Committed offsets partitions={}", snapshot.size());
                return true;
            } catch (WakeupException e) {
                if (running) {
                    throw e;
                }
                log.debug("Wakeup during final commit attempt={}/{}", attempt, maxAttempts);
            } catch (KafkaException e) {
                log.warn("Offset commit failed attempt={}/{} partitions={} error={}",
                        attempt, maxAttempts, snapshot.size(), e.getMessage());
                if (running && attempt < maxAttempts) {
                    cancellation.pause(backOff.nextBackOff());
                }
            }
        }
        metrics.incCommitFailure();
        log.error("Offset commit failed after {} attempts, {} partitions left pending", maxAttempts, snapshot.size());
        return false;
    }
}
