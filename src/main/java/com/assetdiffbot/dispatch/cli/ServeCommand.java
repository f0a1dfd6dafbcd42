package com.assetdiffbot.dispatch.cli;

import com.assetdiffbot.core.events.JobEventBus;
import com.assetdiffbot.core.maintenance.MaintenanceTrigger;
import com.assetdiffbot.core.queue.DirectoryJobQueue;
import com.assetdiffbot.core.queue.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.CountDownLatch;

/**
 * CLI command: assetdiffbot serve
 * <p>
 * Starts the queue worker and the maintenance trigger, prints job events as they happen,
 * and blocks until the process is asked to shut down. Entries left in the queue by an
 * earlier run are picked up first.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the job worker until shutdown")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final JobWorker worker;
    private final MaintenanceTrigger trigger;
    private final DirectoryJobQueue queue;
    private final JobEventBus eventBus;
    private final CountDownLatch shutdown = new CountDownLatch(1);

    public ServeCommand(JobWorker worker, MaintenanceTrigger trigger, DirectoryJobQueue queue,
                        JobEventBus eventBus) {
        this.worker = worker;
        this.trigger = trigger;
        this.queue = queue;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var subscription = eventBus.subscribe(ConsoleOutput::jobEvent);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "serve-shutdown"));

        int pending = queue.size();
        if (pending > 0) {
            ConsoleOutput.info(pending + " queued job(s) from a previous run will be processed first");
        }
        worker.start();
        trigger.start();
        ConsoleOutput.info("Watching " + queue.directory());
        ConsoleOutput.info("Press Ctrl+C to stop.");

        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Serve interrupted");
        } finally {
            trigger.stop();
            worker.stop();
            subscription.unsubscribe();
        }
    }
}
