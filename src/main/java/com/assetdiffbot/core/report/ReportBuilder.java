package com.assetdiffbot.core.report;

import com.assetdiffbot.core.model.AssetDiffResult;
import com.assetdiffbot.core.model.BoundType;
import com.assetdiffbot.core.model.DiffKind;
import com.assetdiffbot.core.model.IdentityChange;

import java.util.ArrayList;
import java.util.List;

import static com.assetdiffbot.core.report.ReportTemplates.image;

/**
 * Formats diff results into report blocks and packs them into chunks.
 * Sprite sheets come first, then maps, each in the order the engines returned them.
 */
public class ReportBuilder {

    public static final String NO_CHANGES = "No renderable asset changes.\n";
    private static final String UNAVAILABLE = "Unavailable";

    private final String title;
    private final String summary;
    private final ReportChunkAssembler assembler;

    public ReportBuilder(String title, String summary, ReportChunkAssembler assembler) {
        this.title = title;
        this.summary = summary;
        this.assembler = assembler;
    }

    public CheckOutputs build(List<AssetDiffResult> sprites, List<AssetDiffResult> maps) {
        var blocks = new ArrayList<String>();
        for (AssetDiffResult result : sprites) {
            blocks.addAll(spriteBlocks(result));
        }
        for (AssetDiffResult result : maps) {
            blocks.addAll(mapBlocks(result));
        }
        if (blocks.isEmpty()) {
            blocks.add(NO_CHANGES);
        }
        return CheckOutputs.of(assembler.assemble(title, summary, blocks));
    }

    /**
     * Interim message shown while a repository is cloned for the first time.
     */
    public ReportChunk cloning() {
        return new ReportChunk(ReportTemplates.CLONING_TITLE, ReportTemplates.CLONING_SUMMARY, "");
    }

    /**
     * Report for a job that failed as a whole.
     */
    public ReportChunk failure(String error) {
        return new ReportChunk(title, summary, ReportTemplates.ERROR.formatted("Job failed", error));
    }

    List<String> spriteBlocks(AssetDiffResult result) {
        if (result.failed()) {
            return List.of(ReportTemplates.ERROR.formatted(result.file(), result.error()));
        }
        if (result.changes().isEmpty()) {
            return List.of();
        }
        var lines = new ArrayList<String>();
        for (IdentityChange change : result.changes()) {
            String changeText = change.failed()
                    ? change.change().text() + " (" + change.renderError() + ")"
                    : change.change().text();
            lines.add(ReportTemplates.SPRITE_LINE.formatted(
                    change.identity().displayName(),
                    change.beforeLink() == null ? "" : image(change.beforeLink()),
                    change.afterLink() == null ? "" : image(change.afterLink()),
                    changeText));
        }
        var section = new ReportSection(result.file(), result.kind().label(), lines);
        var blocks = new ArrayList<String>();
        for (DetailBlock block : assembler.splitSections(List.of(section))) {
            blocks.add(ReportTemplates.SPRITE_DETAILS.formatted(block.changeLabel(), block.title(), block.table()));
        }
        return blocks;
    }

    List<String> mapBlocks(AssetDiffResult result) {
        if (result.failed()) {
            return List.of(ReportTemplates.ERROR.formatted(result.file(), result.error()));
        }
        var blocks = new ArrayList<String>();
        for (IdentityChange change : result.changes()) {
            String name = "%s (%s)".formatted(result.file(), change.identity().displayName());
            if (change.failed()) {
                blocks.add(ReportTemplates.ERROR.formatted(name, change.renderError()));
            } else if (result.kind() == DiffKind.ADDED) {
                blocks.add(ReportTemplates.MAP_ADDED.formatted(name, change.afterLink(),
                        ReportTemplates.IMAGE_ALT, change.afterLink()));
            } else if (result.kind() == DiffKind.REMOVED) {
                blocks.add(ReportTemplates.MAP_REMOVED.formatted(name, change.beforeLink(),
                        ReportTemplates.IMAGE_ALT, change.beforeLink()));
            } else {
                blocks.add(modifiedLevel(name, change));
            }
        }
        return blocks;
    }

    private String modifiedLevel(String name, IdentityChange change) {
        String bounds = change.identity().region().describe();
        BoundType.Kind kind = change.bound() == null ? BoundType.Kind.BOTH : change.bound().kind();
        return switch (kind) {
            case ONLY_HEAD -> ReportTemplates.MAP_MODIFIED.formatted(name, bounds,
                    UNAVAILABLE, link("New", change.afterLink()), UNAVAILABLE,
                    ReportTemplates.Z_LEVEL_ADDED, image(change.afterLink()), ReportTemplates.Z_LEVEL_ADDED);
            case ONLY_BASE -> ReportTemplates.MAP_MODIFIED.formatted(name, bounds,
                    UNAVAILABLE, UNAVAILABLE, UNAVAILABLE,
                    ReportTemplates.Z_LEVEL_DELETED, ReportTemplates.Z_LEVEL_DELETED, ReportTemplates.Z_LEVEL_DELETED);
            case BOTH, NONE -> ReportTemplates.MAP_MODIFIED.formatted(name, bounds,
                    link("Old", change.beforeLink()), link("New", change.afterLink()), link("Diff", change.diffLink()),
                    image(change.beforeLink()), image(change.afterLink()), image(change.diffLink()));
        };
    }

    private static String link(String label, String url) {
        return url == null ? UNAVAILABLE : "[%s](%s)".formatted(label, url);
    }
}
