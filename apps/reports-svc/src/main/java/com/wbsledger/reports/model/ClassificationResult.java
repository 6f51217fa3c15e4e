package com.wbsledger.reports.model;

import java.util.List;

/**
 * Partition of a code set into codes that have at least one child in the set
 * ({@code summary}) and codes that have none ({@code leaf}). Both lists keep the
 * first-seen order of the input.
 */
public record ClassificationResult(List<String> summary, List<String> leaf) {

    public static final ClassificationResult EMPTY = new ClassificationResult(List.of(), List.of());

    public ClassificationResult {
        summary = List.copyOf(summary);
        leaf = List.copyOf(leaf);
    }

    public int size() {
        return summary.size() + leaf.size();
    }
}
