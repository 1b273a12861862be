package com.orderflow.common.kafka.support;

import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * {@code base * 2^(attempt-1)} plus a random jitter in {@code [0, base)}, capped at
 * {@code maxIntervalMs}.
 */
public class JitteredExponentialBackOff implements BackOff {

    private static final int MAX_SHIFT = 30;

    private final long baseMs;
    private final long maxIntervalMs;
    private final LongUnaryOperator jitter;

    public JitteredExponentialBackOff(long baseMs, long maxIntervalMs) {
        this(baseMs, maxIntervalMs, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    public JitteredExponentialBackOff(long baseMs, long maxIntervalMs, Random random) {
        this(baseMs, maxIntervalMs, bound -> (long) (random.nextDouble() * bound));
    }

    private JitteredExponentialBackOff(long baseMs, long maxIntervalMs, LongUnaryOperator jitter) {
        if (baseMs <= 0) {
            throw new IllegalArgumentException("baseMs must be positive");
        }
        this.baseMs = baseMs;
        this.maxIntervalMs = maxIntervalMs;
        this.jitter = jitter;
    }

    @Override
    public BackOffExecution start() {
        return new BackOffExecution() {
            private int attempt;

            @Override
            public long nextBackOff() {
                attempt++;
                long exponential = baseMs << Math.min(attempt - 1, MAX_SHIFT);
                long delay = exponential + jitter.applyAsLong(baseMs);
                return Math.min(delay, maxIntervalMs);
            }
        };
    }
}
