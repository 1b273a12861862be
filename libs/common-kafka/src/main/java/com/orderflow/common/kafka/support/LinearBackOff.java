package com.orderflow.common.kafka.support;

import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

/**
 * {@code base * attempt}, capped at {@code maxIntervalMs}. Never stops on its own; callers bound
 * the number of attempts.
 */
public class LinearBackOff implements BackOff {

    private final long baseMs;
    private final long maxIntervalMs;

    public LinearBackOff(long baseMs, long maxIntervalMs) {
        this.baseMs = baseMs;
        this.maxIntervalMs = maxIntervalMs;
    }

    @Override
    public BackOffExecution start() {
        return new BackOffExecution() {
            private int attempt;

            @Override
            public long nextBackOff() {
                attempt++;
                return Math.min(baseMs * attempt, maxIntervalMs);
            }
        };
    }
}
