package com.assetdiffbot.dispatch.cli;

import com.assetdiffbot.core.queue.DirectoryJobQueue;
import com.assetdiffbot.core.queue.QueuedJob;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: assetdiffbot queue
 * <p>
 * Lists pending queue entries in delivery order.
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "List pending jobs")
@Component
public class QueueCommand implements Runnable {

    private final DirectoryJobQueue queue;

    public QueueCommand(DirectoryJobQueue queue) {
        this.queue = queue;
    }

    @Override
    public void run() {
        var pending = queue.pending();
        if (pending.isEmpty()) {
            ConsoleOutput.info("Queue is empty");
            return;
        }
        ConsoleOutput.info(pending.size() + " pending job(s) in " + queue.directory());
        for (QueuedJob entry : pending) {
            var job = entry.job();
            ConsoleOutput.queueEntry(entry.id(), job.type().name(),
                    job.request() == null ? null : job.request().describe());
        }
    }
}
