package com.wbsledger.reports.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable code-to-description lookup. An empty index is a valid state.
 */
public final class CatalogIndex {

    public static final CatalogIndex EMPTY = new CatalogIndex(Map.of());

    private final Map<String, String> descriptions;

    private CatalogIndex(Map<String, String> descriptions) {
        this.descriptions = descriptions;
    }

    /**
     * Builds an index; for a code listed twice the first description wins.
     */
    public static CatalogIndex of(Iterable<CatalogEntry> entries) {
        Map<String, String> map = new HashMap<>();
        for (CatalogEntry entry : entries) {
            map.putIfAbsent(entry.code(), entry.description());
        }
        return map.isEmpty() ? EMPTY : new CatalogIndex(Collections.unmodifiableMap(map));
    }

    public Optional<String> describe(String code) {
        return Optional.ofNullable(descriptions.get(code));
    }

    public boolean isEmpty() {
        return descriptions.isEmpty();
    }

    public int size() {
        return descriptions.size();
    }
}
