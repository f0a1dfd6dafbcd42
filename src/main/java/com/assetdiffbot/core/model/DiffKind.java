package com.assetdiffbot.core.model;

/**
 * Whole-file classification of an asset diff.
 */
public enum DiffKind {
    ADDED("a", "ADDED"),
    REMOVED("r", "DELETED"),
    MODIFIED("m", "MODIFIED");

    private final String directory;
    private final String label;

    DiffKind(String directory, String label) {
        this.directory = directory;
        this.label = label;
    }

    /** Single-letter artifact subdirectory. */
    public String directory() {
        return directory;
    }

    public String label() {
        return label;
    }
}
