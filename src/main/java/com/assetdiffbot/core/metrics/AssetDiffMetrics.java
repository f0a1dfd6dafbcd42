package com.assetdiffbot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for diff jobs.
 */
@Service
public class AssetDiffMetrics {

    private final MeterRegistry registry;

    public AssetDiffMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(String type, String outcome) {
        Counter.builder("assetdiff.jobs.total")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordJobDuration(long ms) {
        Timer.builder("assetdiff.job.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one rendered artifact.
     *
     * @param assetType "sprite" or "map"
     * @param success   whether the renderer produced a file
     */
    public void recordRender(String assetType, boolean success) {
        Counter.builder("assetdiff.renders.total")
                .description("Artifacts handed to the external renderer")
                .tag("asset", assetType)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records an asset that could not be decoded and was reported inline.
     */
    public void recordAssetError(String assetType) {
        Counter.builder("assetdiff.asset.errors")
                .tag("asset", assetType)
                .register(registry)
                .increment();
    }

    /**
     * Records a failure to reset the clone or delete transient branches after a job.
     */
    public void recordCleanupFailure() {
        Counter.builder("assetdiff.cleanup.failures")
                .description("Reference cleanups that failed after rendering")
                .register(registry)
                .increment();
    }

    public void recordReportChunks(int count) {
        DistributionSummary.builder("assetdiff.report.chunks")
                .description("Report payloads produced per job")
                .register(registry)
                .record(count);
    }

    public void recordQueueDepth(int depth) {
        DistributionSummary.builder("assetdiff.queue.depth")
                .description("Pending entries seen when the worker takes a job")
                .register(registry)
                .record(depth);
    }
}
