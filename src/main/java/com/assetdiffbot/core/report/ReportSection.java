package com.assetdiffbot.core.report;

import java.util.List;

/**
 * All report lines of one asset file, before they are split into detail tables.
 *
 * @param title       file name
 * @param changeLabel ADDED, DELETED or MODIFIED
 * @param lines       one table row per changed identity
 */
public record ReportSection(
    String title,
    String changeLabel,
    List<String> lines
) {

    public ReportSection {
        lines = List.copyOf(lines);
    }
}
