package com.wbsledger.reports.catalog;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "reports.catalog", name = "store", havingValue = "memory")
public class InMemoryCatalogStore implements CatalogStore {

    private final AtomicReference<List<CatalogEntry>> entries = new AtomicReference<>(List.of());

    @Override
    public List<CatalogEntry> findAll() {
        return entries.get();
    }

    @Override
    public int count() {
        return entries.get().size();
    }

    @Override
    public List<CatalogEntry> sample(int limit) {
        List<CatalogEntry> current = entries.get();
        return current.subList(0, Math.min(limit, current.size()));
    }

    @Override
    public void replaceAll(List<CatalogEntry> replacement) {
        entries.set(List.copyOf(replacement));
    }
}
