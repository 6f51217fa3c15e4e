package com.wbsledger.reports.catalog;

public record MappingSummary(int mappedCount, int unmappedCount, int totalCount) {
}
