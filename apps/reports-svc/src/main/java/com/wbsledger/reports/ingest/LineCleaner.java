package com.wbsledger.reports.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class LineCleaner {

    private LineCleaner() {
    }

    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(List.of(text.split("\r\n|\r|\n", -1)));
        // a terminating newline does not open another line
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Drops the profile's discard indices. Indices past the end of a short file are skipped.
     */
    public static List<SourceLine> clean(List<String> lines, CleaningProfile profile) {
        Set<Integer> discarded = profile.resolveDiscarded(lines.size());
        List<SourceLine> kept = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (!discarded.contains(i)) {
                kept.add(new SourceLine(i + 1, lines.get(i)));
            }
        }
        return kept;
    }
}
