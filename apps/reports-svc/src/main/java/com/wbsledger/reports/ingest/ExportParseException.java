package com.wbsledger.reports.ingest;

/**
 * Raised when an export cannot be reconciled into a rectangular row set. Fatal for
 * the file being read, never for the process.
 */
public class ExportParseException extends RuntimeException {

    private final String errorCode;
    private final int line;
    private final int columns;

    public ExportParseException(String errorCode, String message) {
        this(errorCode, message, -1, -1, null);
    }

    public ExportParseException(String errorCode, String message, int line, int columns) {
        this(errorCode, message, line, columns, null);
    }

    public ExportParseException(String errorCode, String message, int line, int columns, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.line = line;
        this.columns = columns;
    }

    public String errorCode() {
        return errorCode;
    }

    /**
     * 1-based line (or table row for HTML exports) the failure was detected on, -1 when not tied to a line.
     */
    public int line() {
        return line;
    }

    public int columns() {
        return columns;
    }
}
