package com.assetdiffbot.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs report text under two size ceilings.
 *
 * <p>Level one splits each file's lines into detail tables no longer than the detail
 * ceiling. Level two packs formatted blocks into report bodies no longer than the report
 * ceiling. Both levels close the current unit only when it is non-empty and the next item
 * would push it past its ceiling, so an item larger than a ceiling on its own still goes out,
 * alone, in its own unit. Packing is deterministic and never reorders or drops text.
 */
public class ReportChunkAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportChunkAssembler.class);

    private final int detailCeiling;
    private final int reportCeiling;

    public ReportChunkAssembler(int detailCeiling, int reportCeiling) {
        if (detailCeiling <= 0 || reportCeiling <= 0) {
            throw new IllegalArgumentException("Ceilings must be positive");
        }
        this.detailCeiling = detailCeiling;
        this.reportCeiling = reportCeiling;
    }

    public int detailCeiling() {
        return detailCeiling;
    }

    public int reportCeiling() {
        return reportCeiling;
    }

    /**
     * Splits every section into detail tables. Each line is followed by a newline in the
     * table. A file that needs more than one table gets a {@code (n)} counter in each title,
     * starting at 1.
     */
    public List<DetailBlock> splitSections(List<ReportSection> sections) {
        var blocks = new ArrayList<DetailBlock>();
        for (ReportSection section : sections) {
            var tables = new ArrayList<String>();
            var current = new StringBuilder();
            for (String line : section.lines()) {
                int added = line.length() + 1;
                if (current.length() > 0 && current.length() + added > detailCeiling) {
                    tables.add(current.toString());
                    current.setLength(0);
                }
                if (added > detailCeiling) {
                    log.warn("Line of {} characters in {} exceeds the detail ceiling of {}",
                            added, section.title(), detailCeiling);
                }
                current.append(line).append('\n');
            }
            if (current.length() > 0) {
                tables.add(current.toString());
            }

            for (int i = 0; i < tables.size(); i++) {
                String title = tables.size() > 1 ? "%s (%d)".formatted(section.title(), i + 1) : section.title();
                blocks.add(new DetailBlock(title, section.changeLabel(), tables.get(i)));
            }
        }
        return blocks;
    }

    /**
     * Packs formatted blocks into report chunks. Concatenating the returned bodies yields
     * the concatenation of {@code blocks}. Returns no chunks for empty input.
     */
    public List<ReportChunk> assemble(String title, String summary, List<String> blocks) {
        var chunks = new ArrayList<ReportChunk>();
        var body = new StringBuilder();
        for (String block : blocks) {
            if (body.length() > 0 && body.length() + block.length() > reportCeiling) {
                chunks.add(new ReportChunk(title, summary, body.toString()));
                body.setLength(0);
            }
            if (block.length() > reportCeiling) {
                log.warn("Report block of {} characters exceeds the report ceiling of {}",
                        block.length(), reportCeiling);
            }
            body.append(block);
        }
        if (body.length() > 0) {
            chunks.add(new ReportChunk(title, summary, body.toString()));
        }
        return chunks;
    }
}
