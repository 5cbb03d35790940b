package com.task.tablescan.model;

import java.util.List;

/**
 * Cells sharing one row band, ordered left to right by {@code x}.
 */
public record Row(List<RowCell> cells) {

    public Row {
        cells = List.copyOf(cells);
    }

    public int size() {
        return cells.size();
    }

    public List<String> texts() {
        return cells.stream().map(RowCell::text).toList();
    }
}
