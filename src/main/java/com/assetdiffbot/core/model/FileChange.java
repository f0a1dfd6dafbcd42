package com.assetdiffbot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single changed file in a pull request.
 *
 * @param filename         path relative to the repository root, as it exists in head
 * @param status           what happened to the file
 * @param previousFilename path in base for renames and copies, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileChange(
    String filename,
    ChangeKind status,
    @JsonProperty("previous_filename") String previousFilename
) {

    public FileChange(String filename, ChangeKind status) {
        this(filename, status, null);
    }

    /**
     * Maps the change onto the paths to read from each revision. A null side means the
     * file does not exist (or is not diffed) at that revision.
     */
    public SourcePaths sourcePaths() {
        return switch (status) {
            case ADDED -> new SourcePaths(null, filename);
            case REMOVED -> new SourcePaths(filename, null);
            case MODIFIED -> new SourcePaths(filename, filename);
            case RENAMED, COPIED -> previousFilename == null || previousFilename.isBlank()
                    ? SourcePaths.NONE
                    : new SourcePaths(previousFilename, filename);
            case UNCHANGED -> SourcePaths.NONE;
        };
    }

    /**
     * Paths of one file on each side of the diff.
     */
    public record SourcePaths(String basePath, String headPath) {

        public static final SourcePaths NONE = new SourcePaths(null, null);

        public boolean isAdded() {
            return basePath == null && headPath != null;
        }

        public boolean isRemoved() {
            return basePath != null && headPath == null;
        }

        public boolean isModified() {
            return basePath != null && headPath != null;
        }

        public boolean isSkipped() {
            return basePath == null && headPath == null;
        }
    }
}
