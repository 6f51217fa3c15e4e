package com.wbsledger.reports.model;

public record OutputCell(ColumnDefinition column, String rawValue, FormattedAmount amount) {

    public String display() {
        return amount != null ? amount.display() : rawValue;
    }
}
