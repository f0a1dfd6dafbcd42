package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.model.DurableJob;

/**
 * A job read back from the queue, with the entry id needed to complete it.
 */
public record QueuedJob(
    String id,
    DurableJob job
) {}
