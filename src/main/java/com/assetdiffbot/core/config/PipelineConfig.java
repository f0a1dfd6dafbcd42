package com.assetdiffbot.core.config;

import com.assetdiffbot.core.asset.MapRenderer;
import com.assetdiffbot.core.asset.SpriteRenderer;
import com.assetdiffbot.core.asset.SpriteSheetCodec;
import com.assetdiffbot.core.asset.TileMapLoader;
import com.assetdiffbot.core.asset.UnconfiguredAssetBackend;
import com.assetdiffbot.core.checkout.CheckoutManager;
import com.assetdiffbot.core.diff.map.MapDiffEngine;
import com.assetdiffbot.core.diff.sprite.SpriteDiffEngine;
import com.assetdiffbot.core.engine.DiffJobProcessor;
import com.assetdiffbot.core.events.JobEventBus;
import com.assetdiffbot.core.maintenance.MaintenanceService;
import com.assetdiffbot.core.maintenance.MaintenanceTrigger;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.queue.DirectoryJobQueue;
import com.assetdiffbot.core.queue.JobIntake;
import com.assetdiffbot.core.queue.JobWorker;
import com.assetdiffbot.core.report.FileReportPublisher;
import com.assetdiffbot.core.report.ReportBuilder;
import com.assetdiffbot.core.report.ReportChunkAssembler;
import com.assetdiffbot.core.report.ReportPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the diff pipeline. Asset codec and renderer beans are expected from the
 * deployment; without them every asset is reported with an inline error.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public CheckoutManager checkoutManager(AssetDiffProperties properties) {
        return new CheckoutManager(properties.getBranchPrefix());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService mapRenderPool(AssetDiffProperties properties) {
        int threads = properties.getRenderThreads();
        var counter = new AtomicInteger();
        log.info("Map render pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "map-render-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean({SpriteSheetCodec.class, SpriteRenderer.class, TileMapLoader.class, MapRenderer.class})
    public UnconfiguredAssetBackend unconfiguredAssetBackend() {
        log.warn("No asset codec or renderer configured; assets will be reported as failed");
        return new UnconfiguredAssetBackend();
    }

    @Bean
    public SpriteDiffEngine spriteDiffEngine(SpriteSheetCodec codec, SpriteRenderer renderer,
                                             AssetDiffMetrics metrics) {
        return new SpriteDiffEngine(codec, renderer, metrics);
    }

    @Bean
    public MapDiffEngine mapDiffEngine(TileMapLoader loader, MapRenderer renderer,
                                       ExecutorService mapRenderPool, AssetDiffMetrics metrics) {
        return new MapDiffEngine(loader, renderer, mapRenderPool, metrics);
    }

    @Bean
    public ReportBuilder reportBuilder(AssetDiffProperties properties) {
        var report = properties.getReport();
        return new ReportBuilder(report.getTitle(), report.getSummary(),
                new ReportChunkAssembler(report.getDetailCeiling(), report.getReportCeiling()));
    }

    @Bean
    @ConditionalOnMissingBean(ReportPublisher.class)
    public ReportPublisher fileReportPublisher(AssetDiffProperties properties, ObjectMapper objectMapper) {
        return new FileReportPublisher(properties.getOutputRoot(),
                properties.getOutput().getFileHostingUrl(), objectMapper);
    }

    @Bean
    public DirectoryJobQueue directoryJobQueue(AssetDiffProperties properties, ObjectMapper objectMapper) {
        return new DirectoryJobQueue(properties.getQueueDir(), objectMapper);
    }

    @Bean
    public JobIntake jobIntake(DirectoryJobQueue queue, JobEventBus eventBus, ReportPublisher publisher) {
        return new JobIntake(queue, eventBus, publisher);
    }

    @Bean
    public MaintenanceService maintenanceService(AssetDiffProperties properties, CheckoutManager checkoutManager) {
        return new MaintenanceService(properties.getOutputRoot(), properties.getReposDir(),
                Duration.ofDays(properties.getMaintenance().getRetentionDays()), checkoutManager, Clock.systemUTC());
    }

    @Bean(destroyMethod = "stop")
    public MaintenanceTrigger maintenanceTrigger(JobIntake intake, AssetDiffProperties properties) {
        return new MaintenanceTrigger(intake, properties.getMaintenance().getCron());
    }

    @Bean
    public DiffJobProcessor diffJobProcessor(AssetDiffProperties properties, CheckoutManager checkoutManager,
                                             SpriteDiffEngine spriteDiffEngine, MapDiffEngine mapDiffEngine,
                                             ReportBuilder reportBuilder, ReportPublisher publisher,
                                             AssetDiffMetrics metrics) {
        return new DiffJobProcessor(properties, checkoutManager, spriteDiffEngine, mapDiffEngine,
                reportBuilder, publisher, metrics);
    }

    @Bean(destroyMethod = "stop")
    public JobWorker jobWorker(DirectoryJobQueue queue, DiffJobProcessor processor, MaintenanceService maintenance,
                               JobEventBus eventBus, AssetDiffMetrics metrics) {
        return new JobWorker(queue, processor, maintenance, eventBus, metrics);
    }
}
