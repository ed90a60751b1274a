package com.enterprise.jobqueue.idempotency;

import com.enterprise.jobqueue.exception.IdempotencyStoreUnavailableException;
import com.enterprise.jobqueue.store.MapDBBackingStore;
import com.enterprise.jobqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the idempotency guard
 */
class IdempotencyGuardTest {

    private MutableClock clock;
    private MapDBBackingStore store;
    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = MapDBBackingStore.inMemory(clock);
        guard = IdempotencyGuard.builder().store(store).clock(clock).build();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testFirstReserveWinsSecondIsDuplicate() throws Exception {
        Reservation first = guard.reserve("order:1");
        Reservation second = guard.reserve("order:1");

        assertTrue(first.isHeld());
        assertFalse(first.isAlreadyHandled());
        assertTrue(second.isAlreadyHandled());
        assertFalse(second.isHeld());
        assertEquals(IdempotencyStatus.IN_PROGRESS, guard.read("order:1").get().getStatus());
    }

    @Test
    void testReleaseCachesResult() throws Exception {
        guard.reserve("order:1");
        guard.release("order:1", "done".getBytes(StandardCharsets.UTF_8), null);

        Reservation duplicate = guard.reserve("order:1");

        assertTrue(duplicate.isAlreadyHandled());
        assertEquals("done", new String(duplicate.getCachedResult().get(), StandardCharsets.UTF_8));
        assertEquals(IdempotencyStatus.COMPLETED, guard.read("order:1").get().getStatus());
    }

    @Test
    void testAbandonFreesInProgressKeyOnly() throws Exception {
        guard.reserve("a");
        guard.abandon("a");
        assertTrue(guard.reserve("a").isHeld());

        guard.release("a", null, null);
        guard.abandon("a");
        assertTrue(guard.reserve("a").isAlreadyHandled());
    }

    @Test
    void testKeyExpiresAfterTtl() throws Exception {
        guard.reserve("k", Duration.ofMinutes(10));
        guard.release("k", null, Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(11));

        assertTrue(guard.reserve("k").isHeld());
    }

    @Test
    void testEmptyKeyIsUnguarded() throws Exception {
        Reservation reservation = guard.reserve("");

        assertFalse(reservation.isHeld());
        assertFalse(reservation.isAlreadyHandled());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testConcurrentReserveLetsExactlyOneThrough() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Reservation>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<Reservation> attempt = () -> {
                    start.await();
                    return guard.reserve("payment:99");
                };
                futures.add(executor.submit(attempt));
            }
            start.countDown();

            int held = 0;
            int duplicates = 0;
            for (Future<Reservation> future : futures) {
                Reservation reservation = future.get();
                if (reservation.isHeld()) {
                    held++;
                }
                if (reservation.isAlreadyHandled()) {
                    duplicates++;
                }
            }
            assertEquals(1, held);
            assertEquals(threads - 1, duplicates);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testFailOpenWhenStoreIsDown() throws Exception {
        store.close();

        Reservation reservation = guard.reserve("k");

        assertFalse(reservation.isHeld());
        assertFalse(reservation.isAlreadyHandled());
    }

    @Test
    void testFailClosedWhenStoreIsDown() {
        IdempotencyGuard strict = IdempotencyGuard.builder()
            .store(store)
            .clock(clock)
            .failMode(FailMode.FAIL_CLOSED)
            .build();
        store.close();

        assertThrows(IdempotencyStoreUnavailableException.class, () -> strict.reserve("k"));
    }

    @Test
    void testKeyPrefixIsApplied() throws Exception {
        IdempotencyGuard prefixed = IdempotencyGuard.builder()
            .store(store)
            .clock(clock)
            .keyPrefix("custom:")
            .build();

        prefixed.reserve("k");

        assertTrue(store.get("custom:k").isPresent());
        assertFalse(store.get("idempotency:k").isPresent());
    }
}
