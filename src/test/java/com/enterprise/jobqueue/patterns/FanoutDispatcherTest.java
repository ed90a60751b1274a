package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.core.TaskRegistry;
import com.enterprise.jobqueue.exception.SkipRetryException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FanoutDispatcherTest {

    private TaskCodec codec;
    private FanoutRegistry registry;
    private FanoutDispatcher dispatcher;
    private List<String> received;

    @BeforeEach
    void setUp() {
        codec = new TaskCodec();
        registry = new FanoutRegistry();
        dispatcher = new FanoutDispatcher(registry, codec);
        received = new ArrayList<>();
        registry.register("order.paid", "invoice",
            (context, event) -> received.add("invoice:" + event.getPayload().get("order").asText()));
        registry.register("order.paid", "loyalty",
            (context, event) -> received.add("loyalty:" + event.getPayload().get("order").asText()));
    }

    private TaskContext contextFor(String taskType) {
        return TaskContext.forTask(TaskImpl.builder().type(taskType).build(), Clock.systemUTC());
    }

    private byte[] orderPaid() throws Exception {
        return codec.encodePayload(FanoutEvent.of("order.paid",
            JsonNodeFactory.instance.objectNode().put("order", "A-1")));
    }

    @Test
    void testRoutesToNamedHandler() throws Exception {
        dispatcher.handle(contextFor("fanout:order.paid:loyalty"), orderPaid());

        assertEquals(Arrays.asList("loyalty:A-1"), received);
    }

    @Test
    void testEventTypeMayContainColons() throws Exception {
        registry.register("billing:invoice", "mailer", (context, event) -> received.add("mailer"));

        dispatcher.handle(contextFor("fanout:billing:invoice:mailer"), orderPaid());

        assertEquals(Arrays.asList("mailer"), received);
    }

    @Test
    void testInvalidTaskTypesAreNotRetried() {
        assertThrows(SkipRetryException.class, () -> dispatcher.handle(contextFor("order.paid:invoice"), orderPaid()));
        assertThrows(SkipRetryException.class, () -> dispatcher.handle(contextFor("fanout:order.paid"), orderPaid()));
        assertThrows(SkipRetryException.class, () -> dispatcher.handle(contextFor("fanout:order.paid:"), orderPaid()));
        assertTrue(received.isEmpty());
    }

    @Test
    void testUnknownHandlerIsNotRetried() {
        SkipRetryException e = assertThrows(SkipRetryException.class,
            () -> dispatcher.handle(contextFor("fanout:order.paid:shipping"), orderPaid()));

        assertTrue(e.getMessage().contains("shipping"));
    }

    @Test
    void testMalformedEventIsNotRetried() {
        assertThrows(SkipRetryException.class, () -> dispatcher.handle(contextFor("fanout:order.paid:invoice"),
            "not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testHandlerErrorsPropagate() {
        registry.register("order.refunded", "ledger", (context, event) -> {
            throw new IllegalStateException("ledger offline");
        });

        assertThrows(IllegalStateException.class,
            () -> dispatcher.handle(contextFor("fanout:order.refunded:ledger"), orderPaid()));
    }

    @Test
    void testRegisterAll() {
        TaskRegistry taskRegistry = dispatcher
            .registerAll(TaskRegistry.builder(), Arrays.asList("order.paid", "order.shipped"))
            .build();

        assertEquals(2, taskRegistry.size());
        assertTrue(taskRegistry.isRegistered("fanout:order.paid:invoice"));
        assertTrue(taskRegistry.isRegistered("fanout:order.paid:loyalty"));
    }
}
