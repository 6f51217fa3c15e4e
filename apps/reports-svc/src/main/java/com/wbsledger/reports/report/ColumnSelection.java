package com.wbsledger.reports.report;

import com.wbsledger.reports.ingest.ExportParseException;
import com.wbsledger.reports.model.ColumnDefinition;
import com.wbsledger.reports.model.ColumnKey;
import com.wbsledger.reports.model.ColumnRole;
import com.wbsledger.reports.model.ExportTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Which columns of a report type hold the code and which hold amounts. Numeric
 * columns are either listed by key or taken as every column from an index onwards,
 * minus the code column and the listed text columns.
 */
public record ColumnSelection(
        ColumnKey codeColumn,
        Integer codeColumnIndex,
        CodeExtraction codeExtraction,
        List<ColumnKey> numericColumns,
        Integer numericFromColumn,
        List<ColumnKey> textColumns
) {

    public ColumnSelection {
        if (codeColumn == null && codeColumnIndex == null) {
            throw new IllegalArgumentException("codeColumn or codeColumnIndex must be provided");
        }
        if (codeExtraction == null) {
            codeExtraction = CodeExtraction.WHOLE_VALUE;
        }
        numericColumns = numericColumns == null ? List.of() : List.copyOf(numericColumns);
        textColumns = textColumns == null ? List.of() : List.copyOf(textColumns);
    }

    /**
     * Assigns a role to every column of {@code table}.
     *
     * @throws ExportParseException when a configured column is not in the export
     */
    public List<ColumnDefinition> bind(ExportTable table) {
        int codeIndex = resolveCodeIndex(table);
        Set<Integer> numeric = new HashSet<>();
        for (ColumnKey key : numericColumns) {
            numeric.add(table.indexOf(key).orElseThrow(() -> missing(key.toString(), table)));
        }
        if (numericFromColumn != null) {
            Set<ColumnKey> text = new HashSet<>(textColumns);
            for (int i = numericFromColumn; i < table.columnCount(); i++) {
                if (!text.contains(table.header().get(i))) {
                    numeric.add(i);
                }
            }
        }
        numeric.remove(codeIndex);

        List<ColumnDefinition> columns = new ArrayList<>(table.columnCount());
        for (int i = 0; i < table.columnCount(); i++) {
            ColumnRole role = i == codeIndex ? ColumnRole.CODE
                    : numeric.contains(i) ? ColumnRole.NUMERIC
                    : ColumnRole.TEXT;
            columns.add(new ColumnDefinition(i, table.header().get(i), role));
        }
        return columns;
    }

    public String extractCode(String cell) {
        if (cell == null) {
            return "";
        }
        return codeExtraction == CodeExtraction.LAST_TOKEN
                ? WbsObjectField.parse(cell).code()
                : cell.trim();
    }

    private int resolveCodeIndex(ExportTable table) {
        if (codeColumn != null) {
            return table.indexOf(codeColumn).orElseThrow(() -> missing(codeColumn.toString(), table));
        }
        if (codeColumnIndex < 0 || codeColumnIndex >= table.columnCount()) {
            throw missing("#" + codeColumnIndex, table);
        }
        return codeColumnIndex;
    }

    private static ExportParseException missing(String column, ExportTable table) {
        return new ExportParseException("MISSING_COLUMN",
                "Column '" + column + "' not found among " + table.header(), -1, table.columnCount());
    }
}
