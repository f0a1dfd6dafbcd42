package com.assetdiffbot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Envelope stored in the on-disk queue.
 *
 * @param type       what the worker should do
 * @param request    the diff request, null for {@link JobType#CLEANUP}
 * @param enqueuedAt when the job was accepted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DurableJob(
    JobType type,
    DiffRequest request,
    Instant enqueuedAt
) {

    public static DurableJob diff(DiffRequest request) {
        return new DurableJob(JobType.DIFF, request, Instant.now());
    }

    public static DurableJob cleanup() {
        return new DurableJob(JobType.CLEANUP, null, Instant.now());
    }
}
