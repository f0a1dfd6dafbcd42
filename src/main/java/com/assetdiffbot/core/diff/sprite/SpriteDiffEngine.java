package com.assetdiffbot.core.diff.sprite;

import com.assetdiffbot.core.asset.AssetDecodeException;
import com.assetdiffbot.core.asset.SpriteRenderer;
import com.assetdiffbot.core.asset.SpriteSheet;
import com.assetdiffbot.core.asset.SpriteSheetCodec;
import com.assetdiffbot.core.asset.SpriteState;
import com.assetdiffbot.core.checkout.RevisionView;
import com.assetdiffbot.core.diff.ArtifactLayout;
import com.assetdiffbot.core.diff.ArtifactNames;
import com.assetdiffbot.core.diff.DiffContext;
import com.assetdiffbot.core.metrics.AssetDiffMetrics;
import com.assetdiffbot.core.model.AssetDiffResult;
import com.assetdiffbot.core.model.AssetIdentity;
import com.assetdiffbot.core.model.DiffKind;
import com.assetdiffbot.core.model.FileChange;
import com.assetdiffbot.core.model.IdentityChange;
import com.assetdiffbot.core.model.IdentityChange.Change;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Diffs sprite sheets state by state.
 *
 * <p>Added and removed sheets have every state rendered. For modified sheets, state names
 * present on one side only are reported as created or deleted. States present on both
 * sides are compared by metadata first; only when the metadata is equal are both sides
 * rasterized and compared pixel by pixel, so attribute-only changes never pay for a render
 * pass.
 *
 * <p>Each artifact is named by {@link ArtifactNames#spriteState}, which makes re-runs
 * overwrite their own output.
 */
public class SpriteDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(SpriteDiffEngine.class);

    private final SpriteSheetCodec codec;
    private final SpriteRenderer renderer;
    private final AssetDiffMetrics metrics;

    public SpriteDiffEngine(SpriteSheetCodec codec, SpriteRenderer renderer, AssetDiffMetrics metrics) {
        this.codec = codec;
        this.renderer = renderer;
        this.metrics = metrics;
    }

    /**
     * Diffs every sprite sheet in {@code files}, in order. Files whose status maps to no
     * revision on either side are skipped.
     */
    public List<AssetDiffResult> diff(DiffContext context, List<FileChange> files) {
        var results = new ArrayList<AssetDiffResult>();
        for (FileChange file : files) {
            var paths = file.sourcePaths();
            if (paths.isSkipped()) {
                log.warn("Skipping sprite sheet {} with status {}", file.filename(), file.status());
                continue;
            }
            results.add(diffFile(context, file, paths));
        }
        return results;
    }

    AssetDiffResult diffFile(DiffContext context, FileChange file, FileChange.SourcePaths paths) {
        DiffKind kind = paths.isAdded() ? DiffKind.ADDED
                : paths.isRemoved() ? DiffKind.REMOVED
                : DiffKind.MODIFIED;

        LoadedSheet before;
        LoadedSheet after;
        try {
            before = paths.basePath() == null ? null : load(context.base(), paths.basePath());
            after = paths.headPath() == null ? null : load(context.head(), paths.headPath());
        } catch (AssetDecodeException e) {
            log.warn("Could not decode sprite sheet {}: {}", file.filename(), e.getMessage());
            metrics.recordAssetError("sprite");
            return AssetDiffResult.failed(file.filename(), kind, e.getMessage());
        }

        Path directory;
        try {
            directory = context.layout().directoryFor(kind, file.filename());
        } catch (UncheckedIOException e) {
            log.warn("Could not create artifact directory for {}: {}", file.filename(), e.getMessage());
            metrics.recordAssetError("sprite");
            return AssetDiffResult.failed(file.filename(), kind, e.getMessage());
        }
        var changes = switch (kind) {
            case ADDED -> renderAll(context.layout(), directory, after, Change.CREATED);
            case REMOVED -> renderAll(context.layout(), directory, before, Change.DELETED);
            case MODIFIED -> compare(context.layout(), directory, before, after);
        };
        log.debug("Sprite sheet {} ({}): {} changed states", file.filename(), kind, changes.size());
        return AssetDiffResult.of(file.filename(), kind, changes);
    }

    private List<IdentityChange> renderAll(ArtifactLayout layout, Path directory, LoadedSheet sheet, Change change) {
        var changes = new ArrayList<IdentityChange>();
        for (SpriteState state : sheet.sheet().states()) {
            var rendered = render(layout, directory, sheet, state, change == Change.CREATED ? "added" : "removed");
            var identity = AssetIdentity.spriteState(state.name(), state.duplicateIndex());
            changes.add(change == Change.CREATED
                    ? new IdentityChange(identity, change, null, null, rendered.link(), null, rendered.error())
                    : new IdentityChange(identity, change, null, rendered.link(), null, null, rendered.error()));
        }
        return changes;
    }

    private List<IdentityChange> compare(ArtifactLayout layout, Path directory, LoadedSheet before, LoadedSheet after) {
        Set<String> beforeNames = before.sheet().stateNames();
        Set<String> afterNames = after.sheet().stateNames();
        var changes = new ArrayList<IdentityChange>();

        for (String name : beforeNames) {
            if (!afterNames.contains(name)) {
                SpriteState state = before.sheet().state(name).orElseThrow();
                var rendered = render(layout, directory, before, state, "removed");
                changes.add(new IdentityChange(AssetIdentity.spriteState(name, state.duplicateIndex()),
                        Change.DELETED, null, rendered.link(), null, null, rendered.error()));
            }
        }
        for (String name : afterNames) {
            if (!beforeNames.contains(name)) {
                SpriteState state = after.sheet().state(name).orElseThrow();
                var rendered = render(layout, directory, after, state, "added");
                changes.add(new IdentityChange(AssetIdentity.spriteState(name, state.duplicateIndex()),
                        Change.CREATED, null, null, rendered.link(), null, rendered.error()));
            }
        }

        var shared = new LinkedHashSet<>(beforeNames);
        shared.retainAll(afterNames);
        for (String name : shared) {
            SpriteState beforeState = before.sheet().state(name).orElseThrow();
            SpriteState afterState = after.sheet().state(name).orElseThrow();
            var identity = AssetIdentity.spriteState(name, beforeState.duplicateIndex());

            boolean differs;
            try {
                differs = differs(before.sheet(), beforeState, after.sheet(), afterState);
            } catch (RuntimeException e) {
                log.warn("Could not compare state '{}': {}", name, e.getMessage());
                metrics.recordRender("sprite", false);
                changes.add(new IdentityChange(identity, Change.MODIFIED, null, null, null, null,
                        "Failed to compare: " + e.getMessage()));
                continue;
            }
            if (!differs) {
                continue;
            }

            var beforeRender = render(layout, directory, before, beforeState, "before");
            var afterRender = render(layout, directory, after, afterState, "after");
            String error = beforeRender.error() != null ? beforeRender.error() : afterRender.error();
            changes.add(new IdentityChange(identity, Change.MODIFIED, null,
                    beforeRender.link(), afterRender.link(), null, error));
        }
        return changes;
    }

    /**
     * Metadata first; pixels only when metadata matches.
     */
    boolean differs(SpriteSheet beforeSheet, SpriteState beforeState, SpriteSheet afterSheet, SpriteState afterState) {
        if (!beforeState.equals(afterState)) {
            return true;
        }
        var beforeFrames = renderer.renderFrames(beforeSheet, beforeState);
        var afterFrames = renderer.renderFrames(afterSheet, afterState);
        return !beforeFrames.samePixelsAs(afterFrames);
    }

    private Rendered render(ArtifactLayout layout, Path directory, LoadedSheet sheet, SpriteState state, String suffix) {
        String name = ArtifactNames.spriteState(sheet.sha(), sheet.file(), sheet.contentHash(),
                state.duplicateIndex(), state.name());
        Path target = directory.resolve(name + "-" + suffix);
        try {
            Path written = renderer.renderState(sheet.sheet(), state, target);
            metrics.recordRender("sprite", true);
            return new Rendered(layout.linkFor(written), null);
        } catch (RuntimeException e) {
            log.warn("Failed to render state '{}' of {} to {}: {}", state.name(), sheet.file(), target, e.getMessage());
            metrics.recordRender("sprite", false);
            return new Rendered(null, "Failed to render: " + e.getMessage());
        }
    }

    private LoadedSheet load(RevisionView view, String file) {
        Path path = view.resolve(file);
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new AssetDecodeException("%s does not exist at %s".formatted(file, view.ref().commit()), e);
        } catch (IOException e) {
            throw new AssetDecodeException("Failed to read %s: %s".formatted(file, e.getMessage()), e);
        }
        SpriteSheet sheet;
        try {
            sheet = codec.decode(raw);
        } catch (AssetDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AssetDecodeException("Failed to decode %s: %s".formatted(file, e.getMessage()), e);
        }
        return new LoadedSheet(file, view.ref().commit(), ArtifactNames.contentHash(raw), sheet);
    }

    private record LoadedSheet(String file, String sha, String contentHash, SpriteSheet sheet) {}

    private record Rendered(String link, String error) {}
}
