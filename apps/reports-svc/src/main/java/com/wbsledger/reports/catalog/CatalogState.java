package com.wbsledger.reports.catalog;

public enum CatalogState {
    NOT_LOADED,
    CHECKING,
    AVAILABLE,
    UNAVAILABLE
}
