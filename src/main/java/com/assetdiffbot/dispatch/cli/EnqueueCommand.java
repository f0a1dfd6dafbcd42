package com.assetdiffbot.dispatch.cli;

import com.assetdiffbot.core.model.DiffRequest;
import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.queue.JobIntake;
import com.assetdiffbot.core.queue.JobQueueException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: assetdiffbot enqueue &lt;file&gt;
 * <p>
 * Reads a diff request JSON document and durably adds it to the queue. A running
 * {@code serve} process picks it up.
 */
@Command(name = "enqueue", mixinStandardHelpOptions = true,
        description = "Durably queue a diff request read from a JSON file")
@Component
public class EnqueueCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Diff request JSON file")
    private Path file;

    private final JobIntake intake;
    private final ObjectMapper objectMapper;

    public EnqueueCommand(JobIntake intake, ObjectMapper objectMapper) {
        this.intake = intake;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        DiffRequest request;
        try {
            request = objectMapper.readValue(file.toFile(), DiffRequest.class);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read diff request " + file + ": " + e.getMessage());
            return 1;
        }
        if (request.repo() == null || request.base() == null || request.head() == null) {
            ConsoleOutput.error("Diff request must name repo, base and head");
            return 1;
        }
        try {
            String id = intake.enqueue(DurableJob.diff(request));
            ConsoleOutput.success("Queued " + request.describe() + " as " + id);
            return 0;
        } catch (JobQueueException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    void setFile(Path file) {
        this.file = file;
    }
}
