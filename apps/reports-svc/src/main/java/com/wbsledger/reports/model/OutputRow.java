package com.wbsledger.reports.model;

import java.util.List;

public record OutputRow(
        int sequence,
        int sourceLine,
        String code,
        RowKind rowKind,
        String description,
        List<OutputCell> cells
) {

    public OutputRow {
        description = description == null ? "" : description;
        cells = List.copyOf(cells);
    }
}
