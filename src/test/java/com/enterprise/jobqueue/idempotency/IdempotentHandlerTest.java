package com.enterprise.jobqueue.idempotency;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.exception.IdempotencyStoreUnavailableException;
import com.enterprise.jobqueue.store.MapDBBackingStore;
import com.enterprise.jobqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotentHandlerTest {

    private MutableClock clock;
    private MapDBBackingStore store;
    private IdempotencyGuard guard;
    private final AtomicInteger invocations = new AtomicInteger();

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

    private TaskContext contextFor(Task task) {
        return TaskContext.forTask(task, clock);
    }

    private Task paymentTask(String paymentId) {
        return TaskImpl.builder()
            .type("payment:capture")
            .payload(("{\"payment_id\":\"" + paymentId + "\"}").getBytes(StandardCharsets.UTF_8))
            .build();
    }

    @Test
    void testDuplicateDeliverySkipsHandlerAndReplaysResult() throws Exception {
        IdempotentHandler handler = IdempotentHandler.wrap((context, payload) -> {
            invocations.incrementAndGet();
            context.writeResult("captured".getBytes(StandardCharsets.UTF_8));
        }, guard);
        Task task = paymentTask("p-1");

        handler.handle(contextFor(task), task.getPayload());
        TaskContext second = contextFor(task);
        handler.handle(second, task.getPayload());

        assertEquals(1, invocations.get());
        assertEquals("captured", new String(second.getResult().get(), StandardCharsets.UTF_8));
    }

    @Test
    void testFailureAllowsRetryToRunAgain() throws Exception {
        IdempotentHandler handler = IdempotentHandler.wrap((context, payload) -> {
            if (invocations.incrementAndGet() == 1) {
                throw new IllegalStateException("transient");
            }
        }, guard);
        Task task = paymentTask("p-2");

        assertThrows(IllegalStateException.class, () -> handler.handle(contextFor(task), task.getPayload()));
        handler.handle(contextFor(task), task.getPayload());

        assertEquals(2, invocations.get());
        assertEquals(IdempotencyStatus.COMPLETED, guard.read(task.getId()).get().getStatus());
    }

    @Test
    void testPayloadFieldKeyDeduplicatesDistinctTasks() throws Exception {
        KeyExtractor byPayment = KeyExtractor.payloadField(new TaskCodec().getObjectMapper(), "payment_id");
        IdempotentHandler handler = new IdempotentHandler(
            (context, payload) -> invocations.incrementAndGet(), guard, byPayment, null);
        Task first = paymentTask("p-3");
        Task resent = paymentTask("p-3");

        handler.handle(contextFor(first), first.getPayload());
        handler.handle(contextFor(resent), resent.getPayload());

        assertNotEquals(first.getId(), resent.getId());
        assertEquals(1, invocations.get());
        assertTrue(guard.read("payment:capture:p-3").isPresent());
    }

    @Test
    void testMissingFieldRunsUnguarded() throws Exception {
        KeyExtractor byPayment = KeyExtractor.payloadField(new TaskCodec().getObjectMapper(), "payment_id");
        IdempotentHandler handler = new IdempotentHandler(
            (context, payload) -> invocations.incrementAndGet(), guard, byPayment, null);
        Task task = TaskImpl.builder().type("payment:capture").payload("{}".getBytes(StandardCharsets.UTF_8)).build();

        handler.handle(contextFor(task), task.getPayload());
        handler.handle(contextFor(task), task.getPayload());

        assertEquals(2, invocations.get());
    }

    @Test
    void testFailClosedRefusesToRunWhenStoreDown() {
        IdempotencyGuard strict = IdempotencyGuard.builder()
            .store(store).clock(clock).failMode(FailMode.FAIL_CLOSED).build();
        IdempotentHandler handler = IdempotentHandler.wrap((context, payload) -> invocations.incrementAndGet(), strict);
        Task task = paymentTask("p-4");
        store.close();

        assertThrows(IdempotencyStoreUnavailableException.class,
            () -> handler.handle(contextFor(task), task.getPayload()));
        assertEquals(0, invocations.get());
    }

    @Test
    void testFailOpenRunsWhenStoreDown() throws Exception {
        IdempotentHandler handler = IdempotentHandler.wrap((context, payload) -> invocations.incrementAndGet(), guard);
        Task task = paymentTask("p-5");
        store.close();

        handler.handle(contextFor(task), task.getPayload());

        assertEquals(1, invocations.get());
    }
}
