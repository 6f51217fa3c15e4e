package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ColumnKey;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds the header rows of an export into one {@link ColumnKey} per column.
 */
public final class HeaderCombiner {

    private HeaderCombiner() {
    }

    /**
     * Width of the header block: one past the last column carrying a non-blank fragment in any header row.
     */
    public static int width(List<List<String>> headerRows) {
        int width = 0;
        for (List<String> row : headerRows) {
            for (int i = row.size() - 1; i >= width; i--) {
                if (!row.get(i).isBlank()) {
                    width = i + 1;
                    break;
                }
            }
        }
        return width;
    }

    public static List<ColumnKey> combine(List<List<String>> headerRows, boolean fillGroupLabels) {
        int width = width(headerRows);
        List<List<String>> rows = new ArrayList<>(headerRows.size());
        for (int r = 0; r < headerRows.size(); r++) {
            List<String> row = headerRows.get(r);
            boolean groupRow = r < headerRows.size() - 1;
            List<String> filled = new ArrayList<>(width);
            String carried = "";
            for (int c = 0; c < width; c++) {
                String fragment = c < row.size() ? row.get(c).trim() : "";
                if (fillGroupLabels && groupRow) {
                    if (fragment.isEmpty()) {
                        fragment = carried;
                    } else {
                        carried = fragment;
                    }
                }
                filled.add(fragment);
            }
            rows.add(filled);
        }

        List<ColumnKey> keys = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<String> levels = new ArrayList<>();
            for (List<String> row : rows) {
                String fragment = row.get(c);
                if (!fragment.isEmpty()) {
                    levels.add(fragment);
                }
            }
            if (levels.isEmpty()) {
                levels.add("column_" + (c + 1));
            }
            keys.add(new ColumnKey(levels));
        }
        return keys;
    }
}
