package com.wbsledger.reports.report;

public class UnknownReportTypeException extends RuntimeException {

    public UnknownReportTypeException(String reportType) {
        super("Unknown report type: " + reportType);
    }
}
