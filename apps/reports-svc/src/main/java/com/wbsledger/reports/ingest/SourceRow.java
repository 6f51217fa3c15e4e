package com.wbsledger.reports.ingest;

import java.util.List;

/**
 * Cells of one export line before the row set is made rectangular.
 */
public record SourceRow(int lineNumber, List<String> cells) {

    public SourceRow {
        cells = List.copyOf(cells);
    }

    /**
     * Cell count ignoring trailing blank cells.
     */
    public int effectiveWidth() {
        for (int i = cells.size() - 1; i >= 0; i--) {
            if (!cells.get(i).isBlank()) {
                return i + 1;
            }
        }
        return 0;
    }
}
