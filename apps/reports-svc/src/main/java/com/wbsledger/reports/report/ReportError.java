package com.wbsledger.reports.report;

import java.util.Map;

public record ReportError(String code, String message, Map<String, Object> details) {
}
