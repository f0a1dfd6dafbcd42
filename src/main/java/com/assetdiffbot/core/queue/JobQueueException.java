package com.assetdiffbot.core.queue;

/**
 * I/O failure of the on-disk job queue.
 */
public class JobQueueException extends RuntimeException {

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
