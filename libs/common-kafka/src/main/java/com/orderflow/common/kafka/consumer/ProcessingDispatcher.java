package com.orderflow.common.kafka.consumer;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.common.kafka.support.CancellationSignal;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Routes a record to the handler registered for its topic and retries retryable failures.
 */
public class ProcessingDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProcessingDispatcher.class);

    private final RecordHandlerRegistry registry;
    private final CommonKafkaProperties.Retry retry;
    private final CancellationSignal cancellation;

    public ProcessingDispatcher(RecordHandlerRegistry registry,
                                CommonKafkaProperties.Retry retry,
                                CancellationSignal cancellation) {
        this.registry = registry;
        this.retry = retry;
        this.cancellation = cancellation;
    }

    /**
     * @return the handler's outcome; on exhaustion the last failure
     * @throws CancellationException if cancelled between attempts; the record is then left unmarked
     */
    public ProcessingOutcome dispatch(ConsumerRecord<String, String> record) {
        Optional<RecordHandler> handler = registry.find(record.topic());
        if (handler.isEmpty()) {
            log.warn("No handler registered topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset());
            return ProcessingOutcome.rejected("No handler registered for topic " + record.topic());
        }

        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        BackOffExecution backOff = backOff().start();
        ProcessingOutcome last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            cancellation.throwIfCancelled();
            last = invoke(handler.get(), record);
            if (last.success() || !last.retryable()) {
                return last;
            }
            log.warn("Processing failed topic={} partition={} offset={} attempt={}/{} message={}",
                    record.topic(), record.partition(), record.offset(), attempt, maxAttempts, last.message());
            if (attempt < maxAttempts) {
                cancellation.pause(backOff.nextBackOff());
            }
        }

        log.error("Processing gave up topic={} partition={} offset={} attempts={}",
                record.topic(), record.partition(), record.offset(), maxAttempts);
        return last;
    }

    private ProcessingOutcome invoke(RecordHandler handler, ConsumerRecord<String, String> record) {
        try {
            ProcessingOutcome outcome = handler.handle(record);
            return outcome != null ? outcome : ProcessingOutcome.failed("Handler returned no outcome");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while processing");
            cancelled.initCause(e);
            throw cancelled;
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            return ProcessingOutcome.failed(
                    "Error processing message from topic " + record.topic() + ": " + e.getMessage(), e);
        }
    }

    private ExponentialBackOff backOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(retry.getInitialBackoffMs(), retry.getMultiplier());
        backOff.setMaxInterval(retry.getMaxBackoffMs());
        return backOff;
    }
}
