package com.wbsledger.reports.model;

import java.util.List;

/**
 * One data line of an export after cleaning. Values are positional and line up
 * with the header of the {@link ExportTable} the row belongs to.
 */
public record RawRow(int sourceLine, List<String> values) {

    public RawRow {
        values = List.copyOf(values);
    }

    public String value(int index) {
        return index < values.size() ? values.get(index) : "";
    }

    public boolean isBlank() {
        return values.stream().allMatch(String::isBlank);
    }
}
