package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.events.JobEvent;
import com.assetdiffbot.core.events.JobEventBus;
import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.report.ReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;

/**
 * Accepts jobs into the durable queue. A job is acknowledged only after it is on disk.
 * Diff jobs are then marked queued on the platform side; a failure to do so leaves the job
 * queued.
 */
public class JobIntake {

    private static final Logger log = LoggerFactory.getLogger(JobIntake.class);

    private final DirectoryJobQueue queue;
    private final JobEventBus eventBus;
    private final ReportPublisher publisher;

    public JobIntake(DirectoryJobQueue queue, JobEventBus eventBus, ReportPublisher publisher) {
        this.queue = queue;
        this.eventBus = eventBus;
        this.publisher = publisher;
    }

    /**
     * @return the queue entry id
     * @throws JobQueueException if the job could not be persisted
     */
    public String enqueue(DurableJob job) {
        String id = queue.enqueue(job);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("type", job.type().name());
        if (job.request() != null) {
            payload.put("request", job.request().describe());
            log.info("Queued {} job {} for {}", job.type(), id, job.request().describe());
        } else {
            log.info("Queued {} job {}", job.type(), id);
        }
        eventBus.publish(JobEvent.of(JobEvent.QUEUED, id, payload));
        if (job.request() != null) {
            try {
                publisher.markQueued(job.request());
            } catch (RuntimeException e) {
                log.warn("Could not mark {} as queued: {}", job.request().describe(), e.getMessage());
            }
        }
        return id;
    }
}
