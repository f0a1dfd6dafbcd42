package com.assetdiffbot.core.report;

import com.assetdiffbot.core.model.DiffRequest;

/**
 * Reporting collaborator on the code-review platform side.
 */
public interface ReportPublisher {

    /**
     * Called once the request is durably queued, before any worker has seen it.
     */
    void markQueued(DiffRequest request);

    /**
     * Called when the worker picks up the request.
     */
    void markStarted(DiffRequest request);

    /**
     * Shows an interim message while the job is running, e.g. during a first clone.
     */
    void reportProgress(DiffRequest request, ReportChunk progress);

    /**
     * Publishes a finished report. The primary chunk first, then each additional chunk in order.
     */
    void publish(DiffRequest request, CheckOutputs outputs);

    /**
     * Publishes a job-level failure. Called at most once per job.
     */
    void publishFailure(DiffRequest request, ReportChunk failure);
}
