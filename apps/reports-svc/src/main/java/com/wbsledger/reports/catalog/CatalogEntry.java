package com.wbsledger.reports.catalog;

public record CatalogEntry(String code, String description) {

    public CatalogEntry {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must be provided");
        }
        code = code.trim();
        description = description == null ? "" : description.trim();
    }
}
