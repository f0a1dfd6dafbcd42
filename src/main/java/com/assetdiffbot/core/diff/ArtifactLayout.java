package com.assetdiffbot.core.diff;

import com.assetdiffbot.core.model.DiffKind;
import com.assetdiffbot.core.model.DiffRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Where a job's rendered artifacts go on disk, and the public links they are served under.
 *
 * <p>Layout: {@code <root>/<owner>/<pull_request>/{a|r|m}/<file_index>/<identity>-<suffix>.<ext>},
 * where owner is the installation id, or the repository id for requests without one.
 */
public final class ArtifactLayout {

    private final Path jobRoot;
    private final String linkBase;

    ArtifactLayout(Path jobRoot, String linkBase) {
        this.jobRoot = jobRoot;
        this.linkBase = linkBase;
    }

    public static ArtifactLayout forRequest(Path outputRoot, String fileHostingUrl, DiffRequest request) {
        long owner = request.installationId() > 0 ? request.installationId() : request.repo().id();
        String relative = owner + "/" + request.pullRequest();
        String base = fileHostingUrl.endsWith("/")
                ? fileHostingUrl.substring(0, fileHostingUrl.length() - 1)
                : fileHostingUrl;
        return new ArtifactLayout(outputRoot.toAbsolutePath().normalize().resolve(relative), base + "/" + relative);
    }

    public Path jobRoot() {
        return jobRoot;
    }

    /**
     * Directory for one asset file's artifacts, created if missing.
     */
    public Path directoryFor(DiffKind kind, String file) {
        Path dir = jobRoot.resolve(kind.directory()).resolve(fileIndex(file));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
        return dir;
    }

    /**
     * Public link of an artifact written under this layout.
     */
    public String linkFor(Path artifact) {
        Path relative = jobRoot.relativize(artifact.toAbsolutePath().normalize());
        return linkBase + "/" + relative.toString().replace('\\', '/');
    }

    /**
     * Flattens a repository path into a single directory name: separators become
     * underscores and the extension is dropped.
     */
    public static String fileIndex(String file) {
        String flat = file.replace('/', '_').replace('\\', '_');
        int dot = flat.lastIndexOf('.');
        return dot > 0 ? flat.substring(0, dot) : flat;
    }
}
