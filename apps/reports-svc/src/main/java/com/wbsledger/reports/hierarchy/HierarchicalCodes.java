package com.wbsledger.reports.hierarchy;

import java.util.Optional;

/**
 * Shape rules for dash-segmented project codes: a child is its parent's full code
 * followed by {@code -} and exactly two ASCII digits ({@code NL-C-001 -> NL-C-001-01}).
 */
public final class HierarchicalCodes {

    static final int CHILD_SUFFIX_LENGTH = 3;

    private HierarchicalCodes() {
    }

    /**
     * Trimmed code, or empty when the value is null or blank.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    /**
     * The code this one would be a direct child of, if its tail has the {@code -DD} shape.
     */
    public static Optional<String> parentOf(String code) {
        int length = code.length();
        if (length <= CHILD_SUFFIX_LENGTH) {
            return Optional.empty();
        }
        if (code.charAt(length - 3) != '-' || !isDigit(code.charAt(length - 2)) || !isDigit(code.charAt(length - 1))) {
            return Optional.empty();
        }
        return Optional.of(code.substring(0, length - CHILD_SUFFIX_LENGTH));
    }

    public static boolean isChildOf(String candidate, String parent) {
        return parentOf(candidate).map(parent::equals).orElse(false);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
