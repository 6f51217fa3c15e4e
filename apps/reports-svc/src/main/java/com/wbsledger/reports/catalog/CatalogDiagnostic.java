package com.wbsledger.reports.catalog;

/**
 * Why descriptions are missing for a whole batch, and how many codes it affected.
 */
public record CatalogDiagnostic(UnavailableReason reason, int totalCodes) {
}
