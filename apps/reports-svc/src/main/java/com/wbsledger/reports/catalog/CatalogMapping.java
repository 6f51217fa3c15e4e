package com.wbsledger.reports.catalog;

import java.util.Map;
import java.util.Optional;

/**
 * Descriptions for one batch of distinct codes. Every input code has an entry;
 * codes without a catalog description map to the empty string.
 */
public record CatalogMapping(
        Map<String, String> descriptions,
        MappingSummary summary,
        Optional<CatalogDiagnostic> diagnostic
) {

    public CatalogMapping {
        descriptions = Map.copyOf(descriptions);
    }

    public String describe(String code) {
        return descriptions.getOrDefault(code, "");
    }
}
