package com.assetdiffbot.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle event of a queued job.
 *
 * @param eventType e.g. {@code job.queued}, {@code job.started}, {@code job.completed}, {@code job.failed}
 * @param jobId     queue entry id
 * @param payload   event details
 * @param timestamp when the event occurred
 */
public record JobEvent(
    String eventType,
    String jobId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String QUEUED = "job.queued";
    public static final String STARTED = "job.started";
    public static final String COMPLETED = "job.completed";
    public static final String FAILED = "job.failed";

    public static JobEvent of(String eventType, String jobId, Map<String, Object> payload) {
        return new JobEvent(eventType, jobId, Map.copyOf(payload), Instant.now());
    }
}
