package com.enterprise.jobqueue.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Polls a condition instead of sleeping a fixed time
 */
public final class Await {

    private Await() {
    }

    public static void until(String description, Duration timeout, BooleanSupplier condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(10);
        }
        if (!condition.getAsBoolean()) {
            fail("Timed out after " + timeout.toMillis() + "ms waiting for " + description);
        }
    }

    public static void until(String description, BooleanSupplier condition) throws InterruptedException {
        until(description, Duration.ofSeconds(10), condition);
    }
}
