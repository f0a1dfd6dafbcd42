package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.engine.DiffJobProcessor;
import com.assetdiffbot.core.engine.JobOutcome;
import com.assetdiffbot.core.events.JobEvent;
import com.assetdiffbot.core.events.JobEventBus;
import com.assetdiffbot.core.logging.MdcContext;
import com.assetdiffbot.core.maintenance.MaintenanceService;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.model.DurableJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single consumer of the job queue. Jobs run one at a time in FIFO order, which is what
 * keeps the shared clones single-writer.
 *
 * <p>An entry is completed after the job succeeds or fails terminally. A failed diff job
 * has already reported its failure through the publisher, so it is not retried.
 */
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private static final Duration TAKE_TIMEOUT = Duration.ofSeconds(1);

    private final DirectoryJobQueue queue;
    private final DiffJobProcessor processor;
    private final MaintenanceService maintenance;
    private final JobEventBus eventBus;
    private final AssetDiffMetrics metrics;

    private volatile boolean running;
    private Thread thread;

    public JobWorker(DirectoryJobQueue queue, DiffJobProcessor processor, MaintenanceService maintenance,
                     JobEventBus eventBus, AssetDiffMetrics metrics) {
        this.queue = queue;
        this.processor = processor;
        this.maintenance = maintenance;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::loop, "job-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("Job worker started on {}", queue.directory());
    }

    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(Duration.ofSeconds(30).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        log.info("Job worker stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            try {
                runOnce(TAKE_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (JobQueueException e) {
                log.error("Queue error: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Takes and handles at most one job.
     *
     * @return true if a job was handled
     */
    boolean runOnce(Duration timeout) throws InterruptedException {
        var next = queue.take(timeout);
        if (next.isEmpty()) {
            return false;
        }
        metrics.recordQueueDepth(queue.size());
        handle(next.get());
        return true;
    }

    void handle(QueuedJob queued) {
        DurableJob job = queued.job();
        String id = queued.id();
        if (job.request() != null) {
            MdcContext.setRequest(id, job.request());
        } else {
            MdcContext.setJob(id);
        }
        long start = System.currentTimeMillis();
        eventBus.publish(JobEvent.of(JobEvent.STARTED, id, Map.of("type", job.type().name())));
        try {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("type", job.type().name());
            switch (job.type()) {
                case DIFF -> {
                    JobOutcome outcome = processor.process(job.request());
                    payload.put("chunks", outcome.outputs().all().size());
                    payload.put("cleanedUp", outcome.cleanedUp());
                }
                case CLEANUP -> {
                    var report = maintenance.runCleanup();
                    payload.put("removed", report.removedDirectories().size());
                }
            }
            metrics.recordJobResult(job.type().name(), "success");
            eventBus.publish(JobEvent.of(JobEvent.COMPLETED, id, payload));
            log.info("{} job {} completed", job.type(), id);
        } catch (RuntimeException e) {
            metrics.recordJobResult(job.type().name(), "failure");
            eventBus.publish(JobEvent.of(JobEvent.FAILED, id, Map.of(
                    "type", job.type().name(),
                    "error", String.valueOf(e.getMessage()))));
            log.error("{} job {} failed: {}", job.type(), id, e.getMessage(), e);
        } finally {
            metrics.recordJobDuration(System.currentTimeMillis() - start);
            try {
                queue.complete(id);
            } finally {
                MdcContext.clear();
            }
        }
    }
}
