package org.nostree.nostr;

import java.util.function.BooleanSupplier;

import static org.junit.Assert.fail;

/**
 * Polling helper for asynchronous assertions.
 */
public final class Waiting {

    public static void until(String description, long timeoutMs, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out after " + timeoutMs + "ms waiting for " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for " + description);
            }
        }
    }

    private Waiting() {
    }
}
