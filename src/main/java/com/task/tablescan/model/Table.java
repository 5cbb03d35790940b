package com.task.tablescan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular typed table: one header row of labels plus data rows, all of the
 * same width. A data cell is {@code null} when missing, otherwise a
 * {@link String} or, in {@link ColumnType#NUMERIC} columns, a {@link Number}.
 */
public record Table(
        @JsonProperty("columns")
        List<String> labels,

        @JsonProperty("column_types")
        List<ColumnType> columnTypes,

        @JsonProperty("rows")
        List<List<Object>> rows
) {

    public Table {
        labels = List.copyOf(labels);
        columnTypes = List.copyOf(columnTypes);
        if (columnTypes.size() != labels.size()) {
            throw new IllegalArgumentException("Expected " + labels.size() + " column types, got " + columnTypes.size());
        }
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != labels.size()) {
                throw new IllegalArgumentException("Row width " + row.size() + " does not match header width " + labels.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static Table empty() {
        return new Table(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public int width() {
        return labels.size();
    }

    @JsonIgnore
    public int dataRowCount() {
        return rows.size();
    }

    @JsonIgnore
    public boolean hasData() {
        return !rows.isEmpty();
    }

    public Object cell(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * Header label of the column, or {@code column_<n>} (1-based) when the
     * header cell is blank.
     */
    public String columnLabel(int column) {
        String label = labels.get(column);
        return label == null || label.isBlank() ? "column_" + (column + 1) : label;
    }

    /**
     * Renders the table back to strings, header first, missing cells as "".
     */
    public Grid toGrid() {
        List<List<String>> grid = new ArrayList<>(rows.size() + 1);
        grid.add(labels);
        for (List<Object> row : rows) {
            List<String> rendered = new ArrayList<>(row.size());
            for (Object value : row) {
                rendered.add(render(value));
            }
            grid.add(rendered);
        }
        return new Grid(grid);
    }

    /**
     * Fixed-width text view of the header and the first {@code maxRows} data rows.
     */
    public String preview(int maxRows) {
        if (rows.isEmpty()) {
            return "No data";
        }
        int shown = Math.min(maxRows, rows.size());
        int[] widths = new int[width()];
        for (int c = 0; c < width(); c++) {
            widths[c] = columnLabel(c).length();
            for (int r = 0; r < shown; r++) {
                widths[c] = Math.max(widths[c], render(cell(r, c)).length());
            }
        }

        List<String> lines = new ArrayList<>(shown + 1);
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < width(); c++) {
            appendPadded(sb, columnLabel(c), widths[c], c);
        }
        lines.add(sb.toString().stripTrailing());
        for (int r = 0; r < shown; r++) {
            sb.setLength(0);
            for (int c = 0; c < width(); c++) {
                appendPadded(sb, render(cell(r, c)), widths[c], c);
            }
            lines.add(sb.toString().stripTrailing());
        }
        return String.join("\n", lines);
    }

    public static String render(Object value) {
        return value == null ? "" : value.toString();
    }

    private static void appendPadded(StringBuilder sb, String text, int width, int column) {
        if (column > 0) {
            sb.append("  ");
        }
        sb.append(text);
        sb.append(" ".repeat(width - text.length()));
    }
}
