package com.wbsledger.reports.model;

public enum ColumnRole {
    CODE,
    NUMERIC,
    TEXT
}
