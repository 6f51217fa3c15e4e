package com.wbsledger.reports.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Out-of-band import of the master file into the catalog store, followed by an
 * atomic swap of the session's index. On failure the store and the live index are unchanged.
 */
@Service
public class CatalogImportService {

    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CatalogMasterFile masterFile;
    private final CatalogStore store;
    private final CatalogSession session;

    public CatalogImportService(CatalogMasterFile masterFile, CatalogStore store, CatalogSession session) {
        this.masterFile = masterFile;
        this.store = store;
        this.session = session;
    }

    public ImportOutcome importMasterFile() {
        log.info("Importing catalog master file {}", masterFile.path());
        List<CatalogEntry> entries = masterFile.readEntries();
        Map<String, CatalogEntry> unique = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            unique.putIfAbsent(entry.code(), entry);
        }
        int duplicates = entries.size() - unique.size();
        if (duplicates > 0) {
            log.warn("Catalog master file lists {} duplicate code(s); first occurrence kept", duplicates);
        }
        store.replaceAll(new ArrayList<>(unique.values()));
        CatalogSnapshot snapshot = session.reload();
        log.info("Catalog import completed: {} entries imported", unique.size());
        return new ImportOutcome(unique.size(), duplicates, snapshot.statusLabel());
    }

    public record ImportOutcome(int imported, int duplicatesSkipped, String catalogStatus) {
    }
}
