package com.wbsledger.reports.model;

/**
 * Non-fatal findings of one report run, meant for a banner or a log line.
 * {@code unavailableReason} is null unless the catalog ran in degraded mode.
 */
public record ReportDiagnostics(
        int totalCodes,
        int mappedCount,
        int unmappedCount,
        String catalogStatus,
        String unavailableReason,
        int summaryCount,
        int leafCount,
        int encodingAnomalies,
        int formatFallbacks,
        int skippedRows
) {

    public boolean degraded() {
        return unavailableReason != null;
    }
}
