package com.orderflow.common.kafka.support;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide stop flag observed by the consumer loop, retry delays and producers.
 * Once cancelled it stays cancelled.
 */
public class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Waits for {@code millis} unless cancellation arrives first.
     *
     * @throws CancellationException if the signal is or becomes cancelled, or the calling thread
     *                               is interrupted (the interrupt flag is restored)
     */
    public void pause(long millis) {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            if (cancelled.await(millis, TimeUnit.MILLISECONDS)) {
                throw new CancellationException("Operation cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted while waiting");
            cancellation.initCause(e);
            throw cancellation;
        }
    }
}
