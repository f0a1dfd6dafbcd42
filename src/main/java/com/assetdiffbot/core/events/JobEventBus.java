package com.assetdiffbot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans job lifecycle events out to in-process listeners such as the console of {@code serve}.
 *
 * <p>Listeners run on the publishing thread, in registration order. A listener that throws
 * is logged and skipped; publishing never fails because of a listener.
 */
@Service
public class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final CopyOnWriteArrayList<Consumer<JobEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(JobEvent event) {
        log.debug("Job {}: {}", event.jobId(), event.eventType());
        for (Consumer<JobEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for job {}: {}", event.eventType(), event.jobId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for every job event.
     *
     * @return handle that removes the listener again
     */
    public Subscription subscribe(Consumer<JobEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
