package com.wbsledger.reports.catalog;

public enum UnavailableReason {
    /** The master file that would populate the catalog does not exist. */
    SOURCE_MISSING("source-missing"),
    /** The master file exists but has not been imported into the catalog store. */
    NOT_IMPORTED("not-imported");

    private final String code;

    UnavailableReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
