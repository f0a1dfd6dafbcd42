package com.assetdiffbot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * File status as reported by the review platform.
 */
public enum ChangeKind {
    ADDED,
    REMOVED,
    MODIFIED,
    RENAMED,
    COPIED,
    UNCHANGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a platform status. {@code "changed"} (mode-only changes) is folded into
     * {@link #MODIFIED}.
     */
    @JsonCreator
    public static ChangeKind fromWire(String status) {
        if (status == null) {
            throw new IllegalArgumentException("File status must not be null");
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        if ("changed".equals(normalized)) {
            return MODIFIED;
        }
        return ChangeKind.valueOf(normalized.toUpperCase(Locale.ROOT));
    }
}
