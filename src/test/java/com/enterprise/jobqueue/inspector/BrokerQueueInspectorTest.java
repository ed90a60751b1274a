package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.InvalidPageException;
import com.enterprise.jobqueue.exception.InvalidQueueException;
import com.enterprise.jobqueue.exception.TaskNotFoundException;
import com.enterprise.jobqueue.store.MapDBBackingStore;
import com.enterprise.jobqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Admin queue inspection tests
 */
class BrokerQueueInspectorTest {

    private MutableClock clock;
    private MapDBBackingStore store;
    private TaskBroker broker;
    private BrokerQueueInspector inspector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = MapDBBackingStore.inMemory(clock);
        broker = TaskBroker.builder().store(store).clock(clock).build();
        inspector = new BrokerQueueInspector(broker);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private String enqueue(String queue, String payload) throws Exception {
        return broker.enqueue(queue, TaskImpl.builder()
            .type("email:send")
            .maxRetry(3)
            .payload(payload.getBytes(StandardCharsets.UTF_8))
            .build());
    }

    private List<String> failTasks(String queue, int count) throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            enqueue(queue, "{\"n\":" + i + "}");
            Task active = broker.dequeue(Duration.ZERO).get();
            broker.fail(active, "error " + i);
            ids.add(active.getId());
            clock.advance(Duration.ofSeconds(1));
        }
        return ids;
    }

    @Test
    void testStatsPerQueue() throws Exception {
        failTasks("default", 1);
        enqueue("critical", "{}");
        enqueue("critical", "{}");
        enqueue("low", "{}");

        QueueStats stats = inspector.getStats();

        assertEquals(Arrays.asList("critical", "default", "low"),
            stats.getQueues().stream().map(QueueInfo::getName).collect(Collectors.toList()));
        assertEquals(2, stats.getQueue("critical").getPending());
        assertEquals(6, stats.getQueue("critical").getWeight());
        assertEquals(1, stats.getQueue("default").getFailed());
        assertEquals(1, stats.getQueue("default").getProcessed());
        assertEquals(1, stats.getQueue("low").getSize());
        assertEquals(3, stats.getAggregate().getTotalPending());
        assertEquals(clock.instant(), stats.getGeneratedAt());
    }

    @Test
    void testFailedJobsPagination() throws Exception {
        List<String> ids = failTasks("default", 25);

        JobPage<FailedJobInfo> first = inspector.listFailedJobs("default", 1, 10);
        JobPage<FailedJobInfo> third = inspector.listFailedJobs("default", 3, 10);

        assertEquals(10, first.getItems().size());
        assertEquals(25, first.getPagination().getTotal());
        assertEquals(3, first.getPagination().getTotalPages());
        assertEquals(5, third.getItems().size());
        assertEquals(ids.get(0), first.getItems().get(0).getTaskId());
        assertEquals(ids.get(24), third.getItems().get(4).getTaskId());
        assertEquals("error 0", first.getItems().get(0).getErrorMessage());
        assertTrue(inspector.listFailedJobs("default", 4, 10).getItems().isEmpty());
    }

    @Test
    void testEmptyQueueHasOnePage() throws Exception {
        JobPage<JobInfo> page = inspector.listJobs("low", PageRequest.first());

        assertTrue(page.getItems().isEmpty());
        assertEquals(1, page.getPagination().getTotalPages());
    }

    @Test
    void testListJobsOrderAcrossStates() throws Exception {
        String active = enqueue("default", "{\"a\":1}");
        broker.dequeue(Duration.ZERO);
        String pending1 = enqueue("default", "{}");
        String pending2 = enqueue("default", "{}");
        String scheduled = broker.enqueue("default", TaskImpl.builder()
            .type("report")
            .state(TaskState.SCHEDULED)
            .processAt(clock.instant().plusSeconds(3600))
            .build());

        JobPage<JobInfo> page = inspector.listJobs("default", 1, 20);

        assertEquals(Arrays.asList(active, pending1, pending2, scheduled),
            page.getItems().stream().map(JobInfo::getTaskId).collect(Collectors.toList()));
        assertEquals("active", page.getItems().get(0).getState());
        assertEquals("scheduled", page.getItems().get(3).getState());
        assertNotNull(page.getItems().get(3).getNextProcessAt());

        JobPage<JobInfo> second = inspector.listJobs("default", 2, 2);
        assertEquals(Arrays.asList(pending2, scheduled),
            second.getItems().stream().map(JobInfo::getTaskId).collect(Collectors.toList()));
    }

    @Test
    void testPayloadPreviewIsTruncated() throws Exception {
        StringBuilder longPayload = new StringBuilder();
        for (int i = 0; i < 150; i++) {
            longPayload.append('x');
        }
        enqueue("default", longPayload.toString());

        String preview = inspector.listJobs("default", 1, 10).getItems().get(0).getPayloadPreview();

        assertEquals(103, preview.length());
        assertTrue(preview.endsWith("..."));
    }

    @Test
    void testRetryFailedJobResetsRetries() throws Exception {
        enqueue("default", "{}");
        Task active = broker.dequeue(Duration.ZERO).get();
        active = broker.retry(active, Duration.ZERO, "first");
        active = broker.dequeue(Duration.ZERO).get();
        broker.fail(active, "second");

        JobInfo retried = inspector.retryFailedJob("default", active.getId());

        assertEquals("pending", retried.getState());
        assertEquals(0, retried.getRetried());
        assertEquals(0, inspector.getStats().getQueue("default").getFailed());
        assertEquals(1, inspector.getStats().getQueue("default").getPending());
    }

    @Test
    void testRetryAfterDeleteIsNotFound() throws Exception {
        String id = failTasks("default", 1).get(0);

        inspector.deleteFailedJob("default", id);

        assertThrows(TaskNotFoundException.class, () -> inspector.retryFailedJob("default", id));
        assertThrows(TaskNotFoundException.class, () -> inspector.deleteFailedJob("default", id));
    }

    @Test
    void testFailedJobInWrongQueueIsNotFound() throws Exception {
        String id = failTasks("critical", 1).get(0);

        assertThrows(TaskNotFoundException.class, () -> inspector.retryFailedJob("default", id));
    }

    @Test
    void testInvalidQueue() {
        assertThrows(InvalidQueueException.class, () -> inspector.listJobs("unknown", 1, 10));
        assertThrows(InvalidQueueException.class, () -> inspector.listFailedJobs("", 1, 10));
        assertThrows(InvalidQueueException.class, () -> inspector.retryFailedJob("unknown", "id"));
        assertEquals(Arrays.asList("critical", "default", "low"), inspector.getValidQueues());
    }

    @Test
    void testInvalidPage() throws Exception {
        assertThrows(InvalidPageException.class, () -> inspector.listJobs("default", 0, 10));
        assertThrows(InvalidPageException.class, () -> inspector.listJobs("default", 1, 0));
        assertEquals(100, PageRequest.of(1, 500).getPageSize());
    }
}
