package com.wbsledger.reports.model;

public record ColumnDefinition(int index, ColumnKey key, ColumnRole role) {

    public ColumnDefinition {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        if (key == null || role == null) {
            throw new IllegalArgumentException("key and role must be provided");
        }
    }
}
