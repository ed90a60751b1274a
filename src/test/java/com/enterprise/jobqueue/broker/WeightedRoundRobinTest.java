package com.enterprise.jobqueue.broker;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WeightedRoundRobinTest {

    private final WeightedRoundRobin wrr = new WeightedRoundRobin(Arrays.asList(
        QueueDefinition.of("critical", 6),
        QueueDefinition.of("default", 3),
        QueueDefinition.of("low", 1)));

    private Map<String, Integer> selectMany(int rounds, WeightedRoundRobin.ReadinessProbe<RuntimeException> probe) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < rounds; i++) {
            Optional<String> selected = wrr.select(probe);
            selected.ifPresent(name -> counts.merge(name, 1, Integer::sum));
        }
        return counts;
    }

    @Test
    void testWeightsSplitSaturatedQueues() {
        Map<String, Integer> counts = selectMany(1000, name -> true);

        assertEquals(600, counts.get("critical"));
        assertEquals(300, counts.get("default"));
        assertEquals(100, counts.get("low"));
    }

    @Test
    void testCriticalGetsTwiceDefault() {
        Map<String, Integer> counts = selectMany(900, name -> !name.equals("low"));

        assertEquals(600, counts.get("critical"));
        assertEquals(300, counts.get("default"));
        assertNull(counts.get("low"));
    }

    @Test
    void testLowIsServedEveryCycle() {
        // low is picked at least once within every 10 selections
        int sinceLow = 0;
        for (int i = 0; i < 100; i++) {
            String selected = wrr.select(name -> true).get();
            sinceLow = selected.equals("low") ? 0 : sinceLow + 1;
            assertTrue(sinceLow < 10, "low starved at selection " + i);
        }
    }

    @Test
    void testSingleBusyQueueIsNotBlockedByCredits() {
        for (int i = 0; i < 20; i++) {
            assertEquals(Optional.of("low"), wrr.select(name -> name.equals("low")));
        }
    }

    @Test
    void testNothingReady() {
        assertFalse(wrr.select(name -> false).isPresent());
        assertEquals(6, wrr.getCredit("critical"));
    }

    @Test
    void testRejectsEmptyQueueList() {
        assertThrows(IllegalArgumentException.class, () -> new WeightedRoundRobin(Arrays.asList()));
    }
}
