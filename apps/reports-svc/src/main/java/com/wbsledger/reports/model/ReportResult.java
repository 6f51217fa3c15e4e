package com.wbsledger.reports.model;

import java.util.List;

public record ReportResult(
        String reportType,
        List<ColumnDefinition> columns,
        List<OutputRow> rows,
        ClassificationResult classification,
        ReportDiagnostics diagnostics
) {

    public ReportResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
