package com.wbsledger.reports.model;

public enum RowKind {
    SUMMARY("summary"),
    LEAF("leaf");

    private final String label;

    RowKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
