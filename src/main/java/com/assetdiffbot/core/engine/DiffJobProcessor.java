package com.assetdiffbot.core.engine;

import com.assetdiffbot.core.checkout.CheckoutManager;
import com.assetdiffbot.core.checkout.RevisionPair;
import com.assetdiffbot.core.config.AssetDiffProperties;
import com.assetdiffbot.core.diff.ArtifactLayout;
import com.assetdiffbot.core.diff.DiffContext;
import com.assetdiffbot.core.diff.map.MapDiffEngine;
import com.assetdiffbot.core.diff.sprite.SpriteDiffEngine;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.model.AssetDiffResult;
import com.assetdiffbot.core.model.DiffRequest;
import com.assetdiffbot.core.model.FileChange;
import com.assetdiffbot.core.report.CheckOutputs;
import com.assetdiffbot.core.report.ReportBuilder;
import com.assetdiffbot.core.report.ReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one diff request end to end: checkout, diff, report, cleanup.
 *
 * <p>Transient references are cleaned up on every exit path. If rendering failed, cleanup
 * errors are attached to the render error as suppressed exceptions and the render error
 * propagates. If rendering succeeded, a cleanup error is logged and counted but the report
 * is still published.
 */
public class DiffJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(DiffJobProcessor.class);

    private final AssetDiffProperties properties;
    private final CheckoutManager checkoutManager;
    private final SpriteDiffEngine spriteEngine;
    private final MapDiffEngine mapEngine;
    private final ReportBuilder reportBuilder;
    private final ReportPublisher publisher;
    private final AssetDiffMetrics metrics;

    public DiffJobProcessor(AssetDiffProperties properties,
                            CheckoutManager checkoutManager,
                            SpriteDiffEngine spriteEngine,
                            MapDiffEngine mapEngine,
                            ReportBuilder reportBuilder,
                            ReportPublisher publisher,
                            AssetDiffMetrics metrics) {
        this.properties = properties;
        this.checkoutManager = checkoutManager;
        this.spriteEngine = spriteEngine;
        this.mapEngine = mapEngine;
        this.reportBuilder = reportBuilder;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    /**
     * Processes a request and publishes its report. On failure a failure report is
     * published once and the error is rethrown.
     */
    public JobOutcome process(DiffRequest request) {
        log.info("Processing {}", request.describe());
        publisher.markStarted(request);

        JobOutcome outcome;
        try {
            outcome = render(request);
        } catch (RuntimeException e) {
            log.error("Job for {} failed: {}", request.describe(), e.getMessage(), e);
            try {
                publisher.publishFailure(request, reportBuilder.failure(describeFailure(e)));
            } catch (RuntimeException publishError) {
                e.addSuppressed(publishError);
            }
            throw e;
        }

        publisher.publish(request, outcome.outputs());
        metrics.recordReportChunks(outcome.outputs().all().size());
        return outcome;
    }

    JobOutcome render(DiffRequest request) {
        List<FileChange> sprites = request.files().stream()
                .filter(f -> properties.isSpriteFile(f.filename()))
                .toList();
        List<FileChange> maps = request.files().stream()
                .filter(f -> properties.isMapFile(f.filename()))
                .toList();
        if (sprites.isEmpty() && maps.isEmpty()) {
            log.info("No sprite sheets or maps changed in {}", request.describe());
            return new JobOutcome(reportBuilder.build(List.of(), List.of()), null);
        }

        Path repoDir = properties.getReposDir().resolve(request.repo().fullName());
        if (!checkoutManager.hasClone(repoDir)) {
            try {
                publisher.reportProgress(request, reportBuilder.cloning());
            } catch (RuntimeException e) {
                log.warn("Could not report cloning progress for {}: {}", request.describe(), e.getMessage());
            }
        }
        checkoutManager.ensureClone(properties.remoteUrlFor(request.repo().fullName()), repoDir);
        var layout = ArtifactLayout.forRequest(properties.getOutputRoot(),
                properties.getOutput().getFileHostingUrl(), request);

        Results results;
        RuntimeException failure = null;
        RuntimeException cleanupError = null;
        try {
            RevisionPair pair = checkoutManager.openRevisionPair(repoDir, request.base().sha(),
                    request.head().sha(), request.base().ref(), request.headFetchRef());
            results = checkoutManager.withCheckout(repoDir, pair.base(), base ->
                    checkoutManager.withCheckoutWorktree(repoDir, pair.head(), properties.getWorktreeName(), head -> {
                        var context = new DiffContext(request, base, head, layout);
                        return new Results(spriteEngine.diff(context, sprites), mapEngine.diff(context, maps));
                    }));
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            try {
                checkoutManager.cleanUpReferences(repoDir, request.base().ref());
            } catch (RuntimeException e) {
                metrics.recordCleanupFailure();
                if (failure != null) {
                    failure.addSuppressed(e);
                } else {
                    log.error("Failed to clean up references in {}: {}", repoDir, e.getMessage(), e);
                    cleanupError = e;
                }
            }
        }

        CheckOutputs outputs = reportBuilder.build(results.sprites(), results.maps());
        return new JobOutcome(outputs, cleanupError);
    }

    private static String describeFailure(Throwable e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        var sb = new StringBuilder(message);
        for (Throwable suppressed : e.getSuppressed()) {
            sb.append("\nAlso: ").append(suppressed.getMessage());
        }
        return sb.toString();
    }

    private record Results(List<AssetDiffResult> sprites, List<AssetDiffResult> maps) {}
}
