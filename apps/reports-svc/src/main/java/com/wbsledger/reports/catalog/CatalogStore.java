package com.wbsledger.reports.catalog;

import java.util.List;

/**
 * Persistent home of the reference catalog.
 */
public interface CatalogStore {

    List<CatalogEntry> findAll();

    int count();

    List<CatalogEntry> sample(int limit);

    /**
     * Replaces the whole catalog. Readers see either the old or the new content.
     */
    void replaceAll(List<CatalogEntry> entries);
}
