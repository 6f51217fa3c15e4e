package com.wbsledger.reports.ingest;

public record DecodedText(String text, int anomalies) {
}
