package com.assetdiffbot.core.report;

import java.util.ArrayList;
import java.util.List;

/**
 * The chunks of one job's report. The primary chunk completes the check run; additional
 * chunks are appended as follow-up updates.
 */
public record CheckOutputs(
    ReportChunk primary,
    List<ReportChunk> additional
) {

    public CheckOutputs {
        additional = additional == null ? List.of() : List.copyOf(additional);
    }

    public static CheckOutputs of(List<ReportChunk> chunks) {
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("At least one chunk is required");
        }
        return new CheckOutputs(chunks.get(0), chunks.subList(1, chunks.size()));
    }

    public List<ReportChunk> all() {
        var all = new ArrayList<ReportChunk>(additional.size() + 1);
        all.add(primary);
        all.addAll(additional);
        return all;
    }
}
