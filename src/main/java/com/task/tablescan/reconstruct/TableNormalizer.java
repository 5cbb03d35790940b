package com.task.tablescan.reconstruct;

import com.task.tablescan.model.ColumnType;
import com.task.tablescan.model.Grid;
import com.task.tablescan.model.Table;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns a grid into a rectangular typed {@link Table}.
 *
 * <p>The width is the most common row length, the smaller one on ties. Short
 * rows are padded with empty cells and long rows truncated. The first row is
 * the header; empty data cells become missing. A column becomes numeric only
 * when every non-missing value in it parses as a number.</p>
 */
public class TableNormalizer {

    public Table normalize(Grid grid) {
        int width = modalWidth(grid.rows());
        if (width == 0) {
            return Table.empty();
        }

        List<List<String>> rectangular = new ArrayList<>(grid.size());
        for (List<String> row : grid.rows()) {
            rectangular.add(fit(row, width));
        }

        List<String> header = rectangular.get(0);
        List<List<String>> data = rectangular.subList(1, rectangular.size());

        List<ColumnType> types = new ArrayList<>(width);
        List<List<Object>> cells = new ArrayList<>(data.size());
        for (int r = 0; r < data.size(); r++) {
            cells.add(new ArrayList<>(width));
        }

        for (int c = 0; c < width; c++) {
            List<Number> numbers = numericColumn(data, c);
            types.add(numbers == null ? ColumnType.TEXT : ColumnType.NUMERIC);
            for (int r = 0; r < data.size(); r++) {
                String raw = data.get(r).get(c);
                Object value;
                if (raw.isEmpty()) {
                    value = null;
                } else if (numbers != null) {
                    value = numbers.get(r);
                } else {
                    value = raw;
                }
                cells.get(r).add(value);
            }
        }

        return new Table(header, types, cells);
    }

    static int modalWidth(List<List<String>> rows) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (List<String> row : rows) {
            counts.merge(row.size(), 1, Integer::sum);
        }
        int width = 0;
        int bestCount = 0;
        // ascending keys, strict comparison: ties keep the smaller width
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                width = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return width;
    }

    private static List<String> fit(List<String> row, int width) {
        List<String> fitted = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String cell = i < row.size() ? row.get(i) : null;
            fitted.add(cell == null ? "" : cell);
        }
        return fitted;
    }

    /**
     * Parsed values per row (null where missing), or null when the column
     * has no values or any value is not numeric.
     */
    private static List<Number> numericColumn(List<List<String>> data, int column) {
        List<Number> numbers = new ArrayList<>(data.size());
        boolean any = false;
        for (List<String> row : data) {
            String raw = row.get(column);
            if (raw.isEmpty()) {
                numbers.add(null);
                continue;
            }
            Optional<Number> parsed = parseNumber(raw);
            if (parsed.isEmpty()) {
                return null;
            }
            numbers.add(parsed.get());
            any = true;
        }
        return any ? numbers : null;
    }

    /**
     * Decimal literal to {@code Long} when integral and in range, otherwise
     * {@code Double}. Only finite decimal notation counts: {@code NaN},
     * {@code Infinity}, {@code inf} and type suffixes are not numbers.
     */
    static Optional<Number> parseNumber(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (isIntegralLiteral(text)) {
            try {
                return Optional.of(value.longValueExact());
            } catch (ArithmeticException e) {
                return Optional.of(value.doubleValue());
            }
        }
        return Optional.of(value.doubleValue());
    }

    private static boolean isIntegralLiteral(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!(Character.isDigit(ch) || (i == 0 && (ch == '-' || ch == '+')))) {
                return false;
            }
        }
        return true;
    }
}
