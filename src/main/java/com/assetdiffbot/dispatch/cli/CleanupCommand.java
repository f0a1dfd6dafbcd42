package com.assetdiffbot.dispatch.cli;

import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.queue.JobIntake;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: assetdiffbot cleanup
 * <p>
 * Queues a maintenance run. It goes through the queue so it never overlaps a diff job.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Queue a maintenance run")
@Component
public class CleanupCommand implements Runnable {

    private final JobIntake intake;

    public CleanupCommand(JobIntake intake) {
        this.intake = intake;
    }

    @Override
    public void run() {
        String id = intake.enqueue(DurableJob.cleanup());
        ConsoleOutput.success("Queued maintenance job " + id);
    }
}
