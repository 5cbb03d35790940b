package com.task.tablescan.model;

public enum ColumnType {
    NUMERIC,
    TEXT
}
