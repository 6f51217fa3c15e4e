package com.wbsledger.reports.catalog;

public class CatalogImportException extends RuntimeException {

    private final String errorCode;

    public CatalogImportException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public CatalogImportException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
