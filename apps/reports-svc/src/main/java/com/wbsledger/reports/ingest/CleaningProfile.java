package com.wbsledger.reports.ingest;

import java.nio.charset.Charset;
import java.util.Set;
import java.util.TreeSet;

/**
 * How a raw export of one report type is cleaned before its rows are read.
 * Negative discard indices count from the end, {@code -1} being the last line.
 */
public record CleaningProfile(
        ExportFormat format,
        Charset encoding,
        char delimiter,
        Set<Integer> discardLineIndices,
        int headerRowCount,
        boolean fillGroupLabels,
        int dropTrailingRows
) {

    public CleaningProfile {
        if (format == null) {
            throw new IllegalArgumentException("format must be provided");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("encoding must be provided");
        }
        if (headerRowCount < 1) {
            throw new IllegalArgumentException("headerRowCount must be positive");
        }
        if (dropTrailingRows < 0) {
            throw new IllegalArgumentException("dropTrailingRows must not be negative");
        }
        discardLineIndices = discardLineIndices == null ? Set.of() : Set.copyOf(discardLineIndices);
    }

    /**
     * Absolute indices to drop from a file of {@code totalLines} lines. Indices
     * beyond either end of the file are left out.
     */
    public Set<Integer> resolveDiscarded(int totalLines) {
        Set<Integer> resolved = new TreeSet<>();
        for (int idx : discardLineIndices) {
            int absolute = idx < 0 ? totalLines + idx : idx;
            if (absolute >= 0 && absolute < totalLines) {
                resolved.add(absolute);
            }
        }
        return resolved;
    }
}
