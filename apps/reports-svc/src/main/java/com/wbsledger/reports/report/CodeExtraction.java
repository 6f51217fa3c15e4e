package com.wbsledger.reports.report;

/**
 * How the hierarchical code is taken from the configured code column.
 */
public enum CodeExtraction {
    /** The trimmed cell value is the code. */
    WHOLE_VALUE,
    /** The cell is an object field ({@code ** Pump house NL-C-001-01}); the code is its last token. */
    LAST_TOKEN
}
