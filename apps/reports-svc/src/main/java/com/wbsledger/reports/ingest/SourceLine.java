package com.wbsledger.reports.ingest;

/**
 * A line of the raw export that survived cleaning, with its 1-based position in the original file.
 */
public record SourceLine(int lineNumber, String text) {
}
