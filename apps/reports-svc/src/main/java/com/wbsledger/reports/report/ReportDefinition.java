package com.wbsledger.reports.report;

import com.wbsledger.reports.ingest.CleaningProfile;

public record ReportDefinition(String reportType, CleaningProfile cleaningProfile, ColumnSelection columns) {
}
