package com.wbsledger.reports.catalog;

/**
 * Catalog state as seen by one processing request. {@code index} is non-empty exactly
 * when the state is {@link CatalogState#AVAILABLE}; {@code reason} is set only when unavailable.
 */
public record CatalogSnapshot(CatalogState state, CatalogIndex index, UnavailableReason reason) {

    public static final CatalogSnapshot NOT_LOADED = new CatalogSnapshot(CatalogState.NOT_LOADED, CatalogIndex.EMPTY, null);
    public static final CatalogSnapshot CHECKING = new CatalogSnapshot(CatalogState.CHECKING, CatalogIndex.EMPTY, null);

    public CatalogSnapshot {
        if (state == null || index == null) {
            throw new IllegalArgumentException("state and index must be provided");
        }
        if (state == CatalogState.AVAILABLE && index.isEmpty()) {
            throw new IllegalArgumentException("an available catalog needs a non-empty index");
        }
        if (state == CatalogState.UNAVAILABLE && reason == null) {
            throw new IllegalArgumentException("an unavailable catalog needs a reason");
        }
    }

    public static CatalogSnapshot available(CatalogIndex index) {
        return new CatalogSnapshot(CatalogState.AVAILABLE, index, null);
    }

    public static CatalogSnapshot unavailable(UnavailableReason reason) {
        return new CatalogSnapshot(CatalogState.UNAVAILABLE, CatalogIndex.EMPTY, reason);
    }

    public boolean isAvailable() {
        return state == CatalogState.AVAILABLE;
    }

    public String statusLabel() {
        return switch (state) {
            case AVAILABLE -> "available";
            case UNAVAILABLE -> "unavailable:" + reason.code();
            case CHECKING -> "checking";
            case NOT_LOADED -> "not-loaded";
        };
    }
}
