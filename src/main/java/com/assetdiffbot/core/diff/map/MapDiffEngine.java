package com.assetdiffbot.core.diff.map;

import com.assetdiffbot.core.asset.AssetRenderException;
import com.assetdiffbot.core.asset.MapRenderer;
import com.assetdiffbot.core.asset.TileMap;
import com.assetdiffbot.core.asset.TileMapLoader;
import com.assetdiffbot.core.checkout.RevisionView;
import com.assetdiffbot.core.diff.ArtifactLayout;
import com.assetdiffbot.core.diff.DiffContext;
import com.assetdiffbot.core.diff.UnaccountedAssetsException;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.model.AssetDiffResult;
import com.assetdiffbot.core.model.AssetIdentity;
import com.assetdiffbot.core.model.BoundType;
import com.assetdiffbot.core.model.Bounds;
import com.assetdiffbot.core.model.DiffKind;
import com.assetdiffbot.core.model.FileChange;
import com.assetdiffbot.core.model.IdentityChange;
import com.assetdiffbot.core.model.IdentityChange.Change;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Diffs tile maps level by level.
 *
 * <p>Maps are loaded in two passes: the base pass (removed files and the base side of
 * modified files), then the head pass (added files and the head side of modified files).
 * Renders run on a shared pool in three phases. All base renders finish before any head
 * render starts, and difference images are produced last from the finished pairs. Each task
 * writes only its own level's files.
 */
public class MapDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(MapDiffEngine.class);

    private final TileMapLoader loader;
    private final MapRenderer renderer;
    private final ExecutorService renderPool;
    private final AssetDiffMetrics metrics;

    public MapDiffEngine(TileMapLoader loader, MapRenderer renderer, ExecutorService renderPool,
                         AssetDiffMetrics metrics) {
        this.loader = loader;
        this.renderer = renderer;
        this.renderPool = renderPool;
        this.metrics = metrics;
    }

    /**
     * Diffs every map in {@code files}. Results are ordered added, removed, then modified,
     * each group in input order.
     *
     * @throws UnaccountedAssetsException if the head pass yields a modified map the base pass did not
     */
    public List<AssetDiffResult> diff(DiffContext context, List<FileChange> files) {
        var added = new ArrayList<FileChange>();
        var removed = new ArrayList<FileChange>();
        var modified = new ArrayList<FileChange>();
        for (FileChange file : files) {
            var paths = file.sourcePaths();
            if (paths.isAdded()) added.add(file);
            else if (paths.isRemoved()) removed.add(file);
            else if (paths.isModified()) modified.add(file);
            else log.warn("Skipping map {} with status {}", file.filename(), file.status());
        }

        // Base pass
        var removedMaps = new LinkedHashMap<String, Loaded>();
        for (FileChange file : removed) {
            removedMaps.put(file.filename(), load(context.base(), file.sourcePaths().basePath()));
        }
        var modifiedBase = new LinkedHashMap<String, Loaded>();
        for (FileChange file : modified) {
            modifiedBase.put(file.filename(), load(context.base(), file.sourcePaths().basePath()));
        }

        // Head pass
        var addedMaps = new LinkedHashMap<String, Loaded>();
        for (FileChange file : added) {
            addedMaps.put(file.filename(), load(context.head(), file.sourcePaths().headPath()));
        }
        var modifiedHead = new LinkedHashMap<String, Loaded>();
        for (FileChange file : modified) {
            modifiedHead.put(file.filename(), load(context.head(), file.sourcePaths().headPath()));
        }
        checkAccounted(modifiedBase, modifiedHead);

        var results = new ArrayList<FilePlan>();
        addedMaps.forEach((file, map) -> results.add(planWhole(context, file, DiffKind.ADDED, map)));
        removedMaps.forEach((file, map) -> results.add(planWhole(context, file, DiffKind.REMOVED, map)));
        modifiedBase.forEach((file, base) -> results.add(planModified(context, file, base, modifiedHead.get(file))));

        var baseRenders = new ArrayList<Callable<Void>>();
        var headRenders = new ArrayList<Callable<Void>>();
        var diffRenders = new ArrayList<Callable<Void>>();
        for (FilePlan plan : results) {
            for (LevelPlan level : plan.levels) {
                switch (level.change) {
                    case DELETED -> {
                        if (plan.kind == DiffKind.REMOVED) {
                            baseRenders.add(() -> renderBase(context, plan, level, "removed"));
                        }
                    }
                    case CREATED -> headRenders.add(() -> renderHead(context, plan, level,
                            plan.kind == DiffKind.ADDED ? "added" : "after"));
                    case MODIFIED -> {
                        baseRenders.add(() -> renderBase(context, plan, level, "before"));
                        headRenders.add(() -> renderHead(context, plan, level, "after"));
                        diffRenders.add(() -> renderDifference(context, plan, level));
                    }
                }
            }
        }
        log.debug("Map renders: {} base, {} head, {} difference",
                baseRenders.size(), headRenders.size(), diffRenders.size());
        runPhase(baseRenders);
        runPhase(headRenders);
        runPhase(diffRenders);

        return results.stream().map(FilePlan::toResult).toList();
    }

    /**
     * Every modified map loaded in the head pass must have a base counterpart.
     */
    static void checkAccounted(Map<String, ?> base, Map<String, ?> head) {
        var extra = new ArrayList<String>();
        for (String file : head.keySet()) {
            if (!base.containsKey(file)) {
                extra.add(file);
            }
        }
        if (!extra.isEmpty()) {
            throw new UnaccountedAssetsException(extra);
        }
    }

    private FilePlan planWhole(DiffContext context, String file, DiffKind kind, Loaded loaded) {
        var plan = new FilePlan(file, kind, loaded, loaded);
        if (loaded.error != null || !prepare(context, plan, loaded.map)) {
            return plan;
        }
        TileMap map = loaded.map;
        Change change = kind == DiffKind.ADDED ? Change.CREATED : Change.DELETED;
        for (int z = 0; z < map.levels(); z++) {
            Bounds whole = Bounds.wholeLevel(map.width(), map.height());
            plan.levels.add(new LevelPlan(z, whole, change, null));
        }
        return plan;
    }

    private FilePlan planModified(DiffContext context, String file, Loaded base, Loaded head) {
        var plan = new FilePlan(file, DiffKind.MODIFIED, base, head);
        if (plan.error() != null || !prepare(context, plan, base.map, head.map)) {
            return plan;
        }
        int levels = Math.max(base.map.levels(), head.map.levels());
        for (int z = 0; z < levels; z++) {
            BoundType bound = LevelBounds.classify(base.map, head.map, z);
            switch (bound.kind()) {
                case NONE -> { }
                case ONLY_BASE -> plan.levels.add(new LevelPlan(z,
                        Bounds.wholeLevel(base.map.width(), base.map.height()), Change.DELETED, bound));
                case ONLY_HEAD -> plan.levels.add(new LevelPlan(z,
                        Bounds.wholeLevel(head.map.width(), head.map.height()), Change.CREATED, bound));
                case BOTH -> plan.levels.add(new LevelPlan(z, bound.bounds(), Change.MODIFIED, bound));
            }
        }
        return plan;
    }

    /**
     * Checks the map dimensions and creates the artifact directory. On failure the plan is
     * marked failed and false is returned.
     */
    private boolean prepare(DiffContext context, FilePlan plan, TileMap... maps) {
        for (TileMap map : maps) {
            if (map.width() <= 0 || map.height() <= 0) {
                log.warn("Map {} has no tiles ({}x{})", plan.file, map.width(), map.height());
                metrics.recordAssetError("map");
                plan.failure = "Map %s has no tiles (%dx%d)".formatted(plan.file, map.width(), map.height());
                return false;
            }
        }
        try {
            plan.directory = context.layout().directoryFor(plan.kind, plan.file);
            return true;
        } catch (UncheckedIOException e) {
            log.warn("Could not create artifact directory for {}: {}", plan.file, e.getMessage());
            metrics.recordAssetError("map");
            plan.failure = e.getMessage();
            return false;
        }
    }

    private Void renderBase(DiffContext context, FilePlan plan, LevelPlan level, String suffix) {
        level.beforePath = render(context.base(), plan, plan.base.map, level, suffix);
        level.beforeLink = link(context.layout(), level.beforePath);
        return null;
    }

    private Void renderHead(DiffContext context, FilePlan plan, LevelPlan level, String suffix) {
        level.afterPath = render(context.head(), plan, plan.head.map, level, suffix);
        level.afterLink = link(context.layout(), level.afterPath);
        return null;
    }

    private Void renderDifference(DiffContext context, FilePlan plan, LevelPlan level) {
        if (level.beforePath == null || level.afterPath == null) {
            return null;
        }
        Path target = plan.directory.resolve(levelName(level) + "-diff");
        try {
            level.diffLink = context.layout().linkFor(renderer.renderDifference(level.beforePath, level.afterPath, target));
            metrics.recordRender("map", true);
        } catch (RuntimeException e) {
            log.warn("Failed to render difference of {} level {}: {}", plan.file, level.z + 1, e.getMessage());
            metrics.recordRender("map", false);
            level.recordError("Failed to render difference: " + e.getMessage());
        }
        return null;
    }

    private Path render(RevisionView view, FilePlan plan, TileMap map, LevelPlan level, String suffix) {
        Path target = plan.directory.resolve(levelName(level) + "-" + suffix);
        try {
            Path written = renderer.renderRegion(view.root(), map, level.z, level.region, target);
            metrics.recordRender("map", true);
            return written;
        } catch (RuntimeException e) {
            log.warn("Failed to render {} level {} ({}): {}", plan.file, level.z + 1, suffix, e.getMessage());
            metrics.recordRender("map", false);
            level.recordError("Failed to render: " + e.getMessage());
            return null;
        }
    }

    private static String link(ArtifactLayout layout, Path path) {
        return path == null ? null : layout.linkFor(path);
    }

    /** Artifact files use the zero-based level; the report shows it one-based. */
    private static String levelName(LevelPlan level) {
        return Integer.toString(level.z);
    }

    private void runPhase(List<Callable<Void>> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        List<Future<Void>> futures;
        try {
            futures = renderPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssetRenderException("Interrupted while rendering map levels", e);
        }
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssetRenderException("Interrupted while rendering map levels", e);
            } catch (ExecutionException e) {
                throw new AssetRenderException("Map render task failed: " + e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private Loaded load(RevisionView view, String file) {
        try {
            return new Loaded(loader.load(view.resolve(file)), null);
        } catch (RuntimeException e) {
            log.warn("Could not load map {} at {}: {}", file, view.ref().commit(), e.getMessage());
            metrics.recordAssetError("map");
            return new Loaded(null, "Failed to load %s: %s".formatted(file, e.getMessage()));
        }
    }

    private record Loaded(TileMap map, String error) {}

    private static final class FilePlan {
        final String file;
        final DiffKind kind;
        final Loaded base;
        final Loaded head;
        final List<LevelPlan> levels = new ArrayList<>();
        Path directory;
        String failure;

        FilePlan(String file, DiffKind kind, Loaded base, Loaded head) {
            this.file = file;
            this.kind = kind;
            this.base = base;
            this.head = head;
        }

        String error() {
            if (failure != null) return failure;
            if (base != null && base.error != null) return base.error;
            if (head != null && head.error != null) return head.error;
            return null;
        }

        AssetDiffResult toResult() {
            String error = error();
            if (error != null) {
                return AssetDiffResult.failed(file, kind, error);
            }
            var changes = new ArrayList<IdentityChange>();
            for (LevelPlan level : levels) {
                changes.add(new IdentityChange(AssetIdentity.mapLevel(level.z, level.region), level.change,
                        level.bound, level.beforeLink, level.afterLink, level.diffLink, level.error));
            }
            return AssetDiffResult.of(file, kind, changes);
        }
    }

    /**
     * Mutable render state of one level. Each field is written by at most one task per phase;
     * phases are separated by {@link ExecutorService#invokeAll}.
     */
    private static final class LevelPlan {
        final int z;
        final Bounds region;
        final Change change;
        final BoundType bound;
        volatile Path beforePath;
        volatile Path afterPath;
        volatile String beforeLink;
        volatile String afterLink;
        volatile String diffLink;
        volatile String error;

        LevelPlan(int z, Bounds region, Change change, BoundType bound) {
            this.z = z;
            this.region = region;
            this.change = change;
            this.bound = bound;
        }

        synchronized void recordError(String message) {
            if (error == null) {
                error = message;
            }
        }
    }
}
