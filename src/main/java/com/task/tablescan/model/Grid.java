package com.task.tablescan.model;

import java.util.List;

/**
 * Rows of cell strings before normalization. Rows may differ in length.
 */
public record Grid(List<List<String>> rows) {

    public Grid {
        rows = rows.stream().map(List::copyOf).toList();
    }

    public static Grid fromRows(List<Row> rows) {
        return new Grid(rows.stream().map(Row::texts).toList());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
