package com.assetdiffbot.core.report;

/**
 * One report payload as accepted by the code-review platform.
 */
public record ReportChunk(
    String title,
    String summary,
    String body
) {}
