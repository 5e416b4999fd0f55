package org.nostree.nostr.discovery;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation of a discovery run, checked between batches.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for up to {@code delayMs}, waking early on cancellation.
     *
     * @return true if cancelled
     */
    public boolean sleep(long delayMs) throws InterruptedException {
        if (delayMs <= 0) {
            return isCancelled();
        }
        return cancelled.await(delayMs, TimeUnit.MILLISECONDS);
    }
}
