package com.orderflow.common.kafka.consumer;

import com.orderflow.common.kafka.support.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the {@link EventConsumerLoop} on its own thread for the lifetime of the application context.
 */
public class ConsumerLoopLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoopLifecycle.class);

    private final EventConsumerLoop loop;
    private final CancellationSignal cancellation;
    private final long joinTimeoutMs;
    private volatile Thread thread;

    public ConsumerLoopLifecycle(EventConsumerLoop loop, CancellationSignal cancellation, long joinTimeoutMs) {
        this.loop = loop;
        this.cancellation = cancellation;
        this.joinTimeoutMs = joinTimeoutMs;
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        loop.start();
        Thread worker = new Thread(loop, "kafka-event-consumer");
        worker.setUncaughtExceptionHandler((t, e) -> log.error("Kafka consumer thread died", e));
        worker.start();
        thread = worker;
    }

    @Override
    public synchronized void stop() {
        Thread worker = thread;
        if (worker == null) {
            return;
        }
        cancellation.cancel();
        loop.stop();
        try {
            worker.join(joinTimeoutMs);
            if (worker.isAlive()) {
                log.warn("Kafka consumer thread did not stop within {} ms", joinTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for Kafka consumer thread");
        }
        thread = null;
    }

    @Override
    public boolean isRunning() {
        return thread != null;
    }
}
