package com.wbsledger.reports.catalog;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the catalog snapshot shared by all processing requests.
 *
 * <p>The first call to {@link #snapshot()} checks availability once and memoizes the
 * outcome. {@link #reload()} builds a complete new snapshot and swaps it in with a
 * single reference write; a request that already holds the old snapshot keeps using it.
 */
@Component
public class CatalogSession {

    private static final Logger log = LoggerFactory.getLogger(CatalogSession.class);

    private final CatalogStore store;
    private final CatalogMasterFile masterFile;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.NOT_LOADED);
    private final Object checkLock = new Object();

    public CatalogSession(CatalogStore store, CatalogMasterFile masterFile) {
        this.store = store;
        this.masterFile = masterFile;
    }

    /**
     * Current snapshot, running the one-time availability check if it has not happened yet.
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = current.get();
        if (snapshot.state() != CatalogState.NOT_LOADED && snapshot.state() != CatalogState.CHECKING) {
            return snapshot;
        }
        synchronized (checkLock) {
            snapshot = current.get();
            if (snapshot.state() == CatalogState.NOT_LOADED) {
                current.set(CatalogSnapshot.CHECKING);
                snapshot = check();
                current.set(snapshot);
            }
            return snapshot;
        }
    }

    /**
     * Memoized snapshot without triggering the check.
     */
    public CatalogSnapshot peek() {
        return current.get();
    }

    /**
     * Rebuilds the snapshot from the store and replaces the current one atomically.
     */
    public CatalogSnapshot reload() {
        synchronized (checkLock) {
            CatalogSnapshot fresh = check();
            CatalogSnapshot previous = current.getAndSet(fresh);
            log.info("Catalog reloaded: {} -> {} ({} entries)", previous.statusLabel(), fresh.statusLabel(), fresh.index().size());
            return fresh;
        }
    }

    private CatalogSnapshot check() {
        CatalogIndex index;
        try {
            index = CatalogIndex.of(store.findAll());
        } catch (RuntimeException e) {
            log.warn("Catalog store could not be read, treating catalog as not imported: {}", e.getMessage());
            index = CatalogIndex.EMPTY;
        }
        if (!index.isEmpty()) {
            log.info("Catalog available with {} entries", index.size());
            return CatalogSnapshot.available(index);
        }
        UnavailableReason reason = masterFile.exists() ? UnavailableReason.NOT_IMPORTED : UnavailableReason.SOURCE_MISSING;
        log.warn("Catalog unavailable ({}): descriptions will be left blank", reason.code());
        return CatalogSnapshot.unavailable(reason);
    }
}
