package com.assetdiffbot.core.maintenance;

import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.queue.JobIntake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Enqueues a cleanup job on a cron schedule. The job goes through the queue like any
 * other, so it never runs concurrently with a diff job.
 */
public class MaintenanceTrigger {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceTrigger.class);

    private final JobIntake intake;
    private final CronExpression cron;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "maintenance-trigger");
        t.setDaemon(true);
        return t;
    });
    private volatile ScheduledFuture<?> next;
    private volatile boolean running;

    public MaintenanceTrigger(JobIntake intake, String cron) {
        this.intake = intake;
        this.cron = CronExpression.parse(cron);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduleNext();
        log.info("Maintenance trigger started (cron={})", cron);
    }

    public synchronized void stop() {
        running = false;
        if (next != null) {
            next.cancel(false);
        }
        scheduler.shutdownNow();
    }

    /**
     * Next firing time after {@code from}.
     */
    public ZonedDateTime nextRun(ZonedDateTime from) {
        return cron.next(from);
    }

    private synchronized void scheduleNext() {
        if (!running) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now();
        ZonedDateTime at = nextRun(now);
        if (at == null) {
            log.warn("Cron expression {} never fires again", cron);
            return;
        }
        long delayMs = Math.max(0, Duration.between(now, at).toMillis());
        next = scheduler.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        log.debug("Next maintenance run at {}", at);
    }

    private void fire() {
        try {
            intake.enqueue(DurableJob.cleanup());
        } catch (RuntimeException e) {
            log.error("Failed to enqueue maintenance job: {}", e.getMessage(), e);
        } finally {
            scheduleNext();
        }
    }
}
