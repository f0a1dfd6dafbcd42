package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.engine.DiffJobProcessor;
import com.assetdiffbot.core.engine.JobOutcome;
import com.assetdiffbot.core.events.JobEvent;
import com.assetdiffbot.core.events.JobEventBus;
import com.assetdiffbot.core.maintenance.MaintenanceService;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.model.DiffRequest;
import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.model.RepositoryRef;
import com.assetdiffbot.core.model.Revision;
import com.assetdiffbot.core.report.CheckOutputs;
import com.assetdiffbot.core.report.ReportChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JobWorkerTest {

    @TempDir
    Path tempDir;

    private DirectoryJobQueue queue;
    private DiffJobProcessor processor;
    private MaintenanceService maintenance;
    private SimpleMeterRegistry registry;
    private List<JobEvent> events;
    private JobWorker worker;

    @BeforeEach
    void setUp() {
        queue = new DirectoryJobQueue(tempDir, new ObjectMapper().findAndRegisterModules());
        processor = mock(DiffJobProcessor.class);
        maintenance = mock(MaintenanceService.class);
        registry = new SimpleMeterRegistry();
        var eventBus = new JobEventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(events::add);
        worker = new JobWorker(queue, processor, maintenance, eventBus, new AssetDiffMetrics(registry));
    }

    private static DiffRequest request() {
        return new DiffRequest(7, new RepositoryRef(99, "owner/repo"),
                new Revision("aaa", "main"), new Revision("bbb", "feature"), 42, List.of(), null);
    }

    private static JobOutcome outcome() {
        return new JobOutcome(CheckOutputs.of(List.of(new ReportChunk("t", "s", "b"))), null);
    }

    private List<String> eventTypes() {
        return events.stream().map(JobEvent::eventType).toList();
    }

    @Test
    void runOnceReturnsFalseWhenQueueIsEmpty() throws Exception {
        assertFalse(worker.runOnce(Duration.ZERO));
        verifyNoInteractions(processor, maintenance);
    }

    @Nested
    @DisplayName("Diff jobs")
    class DiffJobs {

        @Test
        void successfulJobIsCompletedAndReported() throws Exception {
            when(processor.process(any())).thenReturn(outcome());
            String id = queue.enqueue(DurableJob.diff(request()));

            assertTrue(worker.runOnce(Duration.ZERO));

            verify(processor).process(request());
            assertEquals(0, queue.size());
            assertEquals(List.of("job.started", "job.completed"), eventTypes());
            assertEquals(id, events.get(1).jobId());
            assertEquals(1, events.get(1).payload().get("chunks"));
            assertEquals(true, events.get(1).payload().get("cleanedUp"));
            assertEquals(1.0, registry.get("assetdiff.jobs.total")
                    .tag("type", "DIFF").tag("outcome", "success").counter().count());
        }

        @Test
        void failedJobIsCompletedAndNotRetried() throws Exception {
            when(processor.process(any())).thenThrow(new IllegalStateException("fetch failed"));
            queue.enqueue(DurableJob.diff(request()));

            assertTrue(worker.runOnce(Duration.ZERO));

            assertEquals(0, queue.size());
            assertFalse(worker.runOnce(Duration.ZERO));
            verify(processor, times(1)).process(any());
            assertEquals(List.of("job.started", "job.failed"), eventTypes());
            assertEquals("fetch failed", events.get(1).payload().get("error"));
            assertEquals(1.0, registry.get("assetdiff.jobs.total")
                    .tag("type", "DIFF").tag("outcome", "failure").counter().count());
        }

        @Test
        void mdcIsClearedAfterJob() throws Exception {
            when(processor.process(any())).thenAnswer(inv -> {
                assertNotNull(MDC.get("jobId"));
                return outcome();
            });
            queue.enqueue(DurableJob.diff(request()));

            worker.runOnce(Duration.ZERO);

            assertNull(MDC.get("jobId"));
        }

        @Test
        void jobsRunInEnqueueOrder() throws Exception {
            var first = request();
            var second = new DiffRequest(7, first.repo(), first.base(), first.head(), 43, List.of(), null);
            when(processor.process(any())).thenReturn(outcome());
            queue.enqueue(DurableJob.diff(first));
            queue.enqueue(DurableJob.diff(second));

            worker.runOnce(Duration.ZERO);
            worker.runOnce(Duration.ZERO);

            var order = inOrder(processor);
            order.verify(processor).process(first);
            order.verify(processor).process(second);
        }
    }

    @Nested
    @DisplayName("Cleanup jobs")
    class CleanupJobs {

        @Test
        void cleanupJobRunsMaintenance() throws Exception {
            when(maintenance.runCleanup()).thenReturn(
                    new MaintenanceService.Report(List.of(tempDir.resolve("7/42")), List.of()));
            queue.enqueue(DurableJob.cleanup());

            assertTrue(worker.runOnce(Duration.ZERO));

            verify(maintenance).runCleanup();
            verifyNoInteractions(processor);
            assertEquals(1, events.get(1).payload().get("removed"));
            assertEquals(0, queue.size());
        }
    }

    @Test
    void startAndStopControlTheWorkerThread() {
        worker.start();
        assertTrue(worker.isRunning());

        worker.stop();
        assertFalse(worker.isRunning());
    }
}
