package com.wbsledger.reports.ingest;

public enum ExportFormat {
    DELIMITED,
    HTML
}
