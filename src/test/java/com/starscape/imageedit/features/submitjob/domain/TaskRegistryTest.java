package com.starscape.imageedit.features.submitjob.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskRegistryTest {

    private static TaskMeta meta(String taskId, Instant dispatchedAt, Duration timeout) {
        return new TaskMeta(taskId, "/tmp/out.png", "job_1", "0", false, dispatchedAt, dispatchedAt.plus(timeout));
    }

    @Test
    void entryIsConsumedOnce() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(meta("t1", Instant.now(), Duration.ofMinutes(1)));

        assertTrue(registry.find("t1").isPresent());
        assertTrue(registry.remove("t1").isPresent());
        assertTrue(registry.remove("t1").isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void duplicateRegistrationIsRejected() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(meta("t1", Instant.now(), Duration.ofMinutes(1)));

        assertThrows(IllegalStateException.class,
            () -> registry.register(meta("t1", Instant.now(), Duration.ofMinutes(1))));
    }

    @Test
    void removeExpiredTakesOnlyEntriesPastTheirDeadline() {
        TaskRegistry registry = new TaskRegistry();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        registry.register(meta("old", start, Duration.ofMinutes(1)));
        registry.register(meta("fresh", start, Duration.ofMinutes(10)));

        List<TaskMeta> expired = registry.removeExpired(start.plus(Duration.ofMinutes(5)));

        assertEquals(1, expired.size());
        assertEquals("old", expired.get(0).taskId());
        assertTrue(registry.find("fresh").isPresent());
        assertEquals(1, registry.size());
    }
}
