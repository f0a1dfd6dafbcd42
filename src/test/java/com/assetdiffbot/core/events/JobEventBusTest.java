package com.assetdiffbot.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link JobEventBus}.
 */
class JobEventBusTest {

    private JobEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new JobEventBus();
    }

    @Test
    @DisplayName("listeners see every job's lifecycle in publish order")
    void listenersSeeEveryJob() {
        var received = new ArrayList<String>();
        eventBus.subscribe(e -> received.add(e.eventType() + ":" + e.jobId()));

        eventBus.publish(JobEvent.of(JobEvent.QUEUED, "J-1", Map.of()));
        eventBus.publish(JobEvent.of(JobEvent.STARTED, "J-1", Map.of()));
        eventBus.publish(JobEvent.of(JobEvent.COMPLETED, "J-2", Map.of("chunks", 1)));

        assertEquals(List.of("job.queued:J-1", "job.started:J-1", "job.completed:J-2"), received);
    }

    @Test
    @DisplayName("listeners run in registration order")
    void registrationOrder() {
        var order = new ArrayList<String>();
        eventBus.subscribe(e -> order.add("console"));
        eventBus.subscribe(e -> order.add("audit"));

        eventBus.publish(JobEvent.of(JobEvent.QUEUED, "J-1", Map.of()));

        assertEquals(List.of("console", "audit"), order);
    }

    @Test
    @DisplayName("unsubscribe stops delivery")
    void unsubscribe() {
        var received = new ArrayList<JobEvent>();
        var subscription = eventBus.subscribe(received::add);

        subscription.unsubscribe();
        eventBus.publish(JobEvent.of(JobEvent.QUEUED, "J-1", Map.of()));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a throwing listener does not block others or the publisher")
    void throwingListenerIsIsolated() {
        var received = new ArrayList<JobEvent>();
        eventBus.subscribe(e -> { throw new IllegalStateException("boom"); });
        eventBus.subscribe(received::add);

        assertDoesNotThrow(() -> eventBus.publish(JobEvent.of(JobEvent.FAILED, "J-1", Map.of("error", "x"))));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("event payload is an immutable copy")
    void payloadIsCopied() {
        var payload = new HashMap<String, Object>();
        payload.put("type", "DIFF");
        var event = JobEvent.of(JobEvent.STARTED, "J-1", payload);
        payload.put("type", "CLEANUP");

        assertEquals("DIFF", event.payload().get("type"));
        assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
        assertNotNull(event.timestamp());
    }
}
