package com.assetdiffbot.core.logging;

import com.assetdiffbot.core.model.DiffRequest;
import org.slf4j.MDC;

/**
 * Utility for managing job-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void setRequest(String jobId, DiffRequest request) {
        MDC.put("jobId", jobId);
        MDC.put("repo", request.repo().fullName());
        MDC.put("pullRequest", String.valueOf(request.pullRequest()));
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("repo");
        MDC.remove("pullRequest");
    }
}
