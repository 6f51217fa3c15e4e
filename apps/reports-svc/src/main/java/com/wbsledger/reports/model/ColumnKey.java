package com.wbsledger.reports.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Compound column key built from the non-empty header fragments of one column,
 * outermost header row first, e.g. {@code ("Budget", "Total")}.
 */
public record ColumnKey(List<String> levels) {

    public static final String CONFIG_SEPARATOR = "|";

    public ColumnKey {
        if (levels == null) {
            throw new IllegalArgumentException("levels must be provided");
        }
        levels = List.copyOf(levels);
    }

    public static ColumnKey of(String... levels) {
        return new ColumnKey(List.of(levels));
    }

    /**
     * Parses the configuration notation {@code "Budget|Total"}.
     */
    public static ColumnKey parse(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new IllegalArgumentException("column key notation must not be blank");
        }
        List<String> parts = new ArrayList<>();
        for (String part : notation.split("\\|")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return new ColumnKey(parts);
    }

    public String label() {
        return String.join(" - ", levels);
    }

    @Override
    public String toString() {
        return String.join(CONFIG_SEPARATOR, levels);
    }
}
