package com.wbsledger.reports.model;

import java.util.List;
import java.util.Optional;

public record ExportTable(
        List<ColumnKey> header,
        List<RawRow> rows,
        int encodingAnomalies,
        int skippedRows
) {

    public ExportTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public int columnCount() {
        return header.size();
    }

    public Optional<Integer> indexOf(ColumnKey key) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equals(key)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
