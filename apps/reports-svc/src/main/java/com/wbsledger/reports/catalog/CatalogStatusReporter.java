package com.wbsledger.reports.catalog;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reports where the catalog master file is, how many catalog records are stored and
 * what the session currently sees.
 */
@Component
public class CatalogStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(CatalogStatusReporter.class);
    private static final int SAMPLE_SIZE = 5;

    private final CatalogMasterFile masterFile;
    private final CatalogStore store;
    private final CatalogSession session;

    public CatalogStatusReporter(CatalogMasterFile masterFile, CatalogStore store, CatalogSession session) {
        this.masterFile = masterFile;
        this.store = store;
        this.session = session;
    }

    @EventListener(ApplicationReadyEvent.class)
    void logStatusOnStartup() {
        try {
            CatalogStatus status = status();
            log.info("Catalog status: masterFile='{}' exists={} bytes={} records={} session={}",
                    status.masterFile(), status.masterFileExists(), status.masterFileBytes(),
                    status.recordCount(), status.sessionStatus());
            if (!status.masterFileExists()) {
                log.warn("Catalog master file not found; place it at {}", status.masterFile());
            }
        } catch (RuntimeException e) {
            log.warn("Catalog status check failed: {}", e.getMessage());
        }
    }

    public CatalogStatus status() {
        int records = store.count();
        List<CatalogEntry> sample = records > 0 ? store.sample(SAMPLE_SIZE) : List.of();
        return new CatalogStatus(
                masterFile.path().toString(),
                masterFile.exists(),
                masterFile.sizeBytes().orElse(0L),
                records,
                sample,
                session.peek().statusLabel()
        );
    }

    public record CatalogStatus(
            String masterFile,
            boolean masterFileExists,
            long masterFileBytes,
            int recordCount,
            List<CatalogEntry> sample,
            String sessionStatus
    ) {
    }
}
