package com.enterprise.jobqueue.retry;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.core.TaskResult;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.SkipRetryException;
import com.enterprise.jobqueue.store.MapDBBackingStore;
import com.enterprise.jobqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureHandlerTest {

    private MutableClock clock;
    private MapDBBackingStore store;
    private TaskBroker broker;
    private final List<Task> retried = new ArrayList<>();
    private final List<Task> terminal = new ArrayList<>();
    private FailureHandler failureHandler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = MapDBBackingStore.inMemory(clock);
        broker = TaskBroker.builder().store(store).clock(clock).build();
        failureHandler = FailureHandler.builder()
            .broker(broker)
            .retryPolicy(RetryPolicy.builder().baseDelay(Duration.ofSeconds(10)).jitterFactor(0).build())
            .retryNotifier(retried::add)
            .terminalNotifier(terminal::add)
            .build();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Task activeTask(int maxRetry) throws Exception {
        broker.enqueue("default", TaskImpl.builder().type("t").maxRetry(maxRetry).build());
        return broker.dequeue(Duration.ZERO).get();
    }

    @Test
    void testRetryableFailureSchedulesRetry() throws Exception {
        Task active = activeTask(3);

        Task stored = failureHandler.handleFailure(active,
            TaskResult.failure(new IOException("timeout talking to smtp"), Duration.ofMillis(3)));

        assertEquals(TaskState.RETRY, stored.getState());
        assertEquals(1, stored.getRetryCount());
        assertEquals(clock.instant().plusSeconds(10), stored.getProcessAt());
        assertEquals("timeout talking to smtp", stored.getLastError());
        assertEquals(1, retried.size());
        assertTrue(terminal.isEmpty());
    }

    @Test
    void testSkipRetryGoesStraightToFailed() throws Exception {
        Task active = activeTask(3);

        Task stored = failureHandler.handleFailure(active,
            TaskResult.failure(new SkipRetryException("invalid payload"), Duration.ZERO));

        assertEquals(TaskState.FAILED, stored.getState());
        assertEquals(0, stored.getRetryCount());
        assertEquals(1, terminal.size());
        assertEquals(1, broker.countTasks("default", TaskState.FAILED));
    }

    @Test
    void testExhaustedBudgetFails() throws Exception {
        Task active = activeTask(0);

        Task stored = failureHandler.handleFailure(active,
            TaskResult.failure(new IOException("down"), Duration.ZERO));

        assertEquals(TaskState.FAILED, stored.getState());
        assertEquals("down", stored.getLastError());
    }

    @Test
    void testNotifierErrorsDoNotBreakTransition() throws Exception {
        FailureHandler noisy = FailureHandler.builder()
            .broker(broker)
            .retryNotifier(task -> {
                throw new IllegalStateException("listener broke");
            })
            .build();
        Task active = activeTask(3);

        Task stored = noisy.handleFailure(active, TaskResult.failure(new IOException("x"), Duration.ZERO));

        assertEquals(TaskState.RETRY, stored.getState());
    }

    @Test
    void testBrokerRequired() {
        assertThrows(IllegalArgumentException.class, () -> FailureHandler.builder().build());
    }
}
