package com.task.tablescan.reconstruct;

import com.task.tablescan.model.ColumnType;
import com.task.tablescan.model.Grid;
import com.task.tablescan.model.Table;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TableNormalizerTest {

    private final TableNormalizer normalizer = new TableNormalizer();

    @Test
    public void testNormalize_PadsAndTruncatesToModalWidth() {
        Grid grid = new Grid(List.of(
                List.of("A", "B"),
                List.of("1"),
                List.of("2", "3", "4"),
                List.of("5", "6")
        ));

        Table table = normalizer.normalize(grid);

        assertEquals(List.of("A", "B"), table.labels());
        assertEquals(3, table.dataRowCount());
        assertEquals(Arrays.asList(1L, null), table.rows().get(0));
        assertEquals(List.of(2L, 3L), table.rows().get(1));
        assertEquals(List.of(5L, 6L), table.rows().get(2));
        assertEquals(List.of(ColumnType.NUMERIC, ColumnType.NUMERIC), table.columnTypes());
    }

    @Test
    public void testNormalize_NumericColumn() {
        Table table = normalizer.normalize(new Grid(List.of(
                List.of("Qty"), List.of("10"), List.of("20"), List.of("30"))));

        assertEquals(ColumnType.NUMERIC, table.columnTypes().get(0));
        assertEquals(10L, table.cell(0, 0));
        assertEquals(30L, table.cell(2, 0));
    }

    @Test
    public void testNormalize_OneBadValueKeepsWholeColumnText() {
        Table table = normalizer.normalize(new Grid(List.of(
                List.of("Qty"), List.of("10"), List.of("abc"), List.of("30"))));

        assertEquals(ColumnType.TEXT, table.columnTypes().get(0));
        assertEquals("10", table.cell(0, 0));
        assertEquals("abc", table.cell(1, 0));
        assertEquals("30", table.cell(2, 0));
    }

    @Test
    public void testNormalize_DecimalsAndMissingValues() {
        Table table = normalizer.normalize(new Grid(List.of(
                List.of("Item", "Price"),
                List.of("Tea", "2.50"),
                List.of("Cake", ""),
                List.of("", "-3")
        )));

        assertEquals(List.of(ColumnType.TEXT, ColumnType.NUMERIC), table.columnTypes());
        assertEquals(2.5, table.cell(0, 1));
        assertNull(table.cell(1, 1));
        assertEquals(-3L, table.cell(2, 1));
        assertNull(table.cell(2, 0));
    }

    @Test
    public void testNormalize_ColumnWithoutValuesIsText() {
        Table table = normalizer.normalize(new Grid(List.of(
                List.of("A", "B"), List.of("x", ""), List.of("y", ""))));

        assertEquals(ColumnType.TEXT, table.columnTypes().get(1));
        assertNull(table.cell(0, 1));
    }

    @Test
    public void testNormalize_EmptyGrid() {
        Table table = normalizer.normalize(new Grid(List.of()));

        assertEquals(0, table.width());
        assertEquals(0, table.dataRowCount());
    }

    @Test
    public void testNormalize_HeaderOnly() {
        Table table = normalizer.normalize(new Grid(List.of(List.of("Name", "Age"))));

        assertEquals(List.of("Name", "Age"), table.labels());
        assertEquals(0, table.dataRowCount());
        assertFalse(table.hasData());
    }

    @Test
    public void testNormalize_UniformGridNeedsNoPadding() {
        Grid grid = new Grid(List.of(
                List.of("Name", "City", "Age"),
                List.of("Alice", "Oslo", "30"),
                List.of("Bob", "Rome", "25")
        ));

        Table table = normalizer.normalize(grid);

        assertEquals(3, table.width());
        assertEquals(List.of("Alice", "Oslo", 30L), table.rows().get(0));
        assertEquals(List.of("Bob", "Rome", 25L), table.rows().get(1));
    }

    @Test
    public void testNormalize_IsIdempotent() {
        Table first = normalizer.normalize(new Grid(List.of(
                List.of("Name", "Score", "Note"),
                List.of("Alice", "1.5", ""),
                List.of("Bob", "20", "late"),
                List.of("Carol")
        )));

        Table second = normalizer.normalize(first.toGrid());

        assertEquals(first, second);
    }

    @Test
    public void testModalWidth_TieGoesToSmallerWidth() {
        assertEquals(2, TableNormalizer.modalWidth(List.of(List.of("a", "b", "c"), List.of("a", "b"))));
        assertEquals(3, TableNormalizer.modalWidth(List.of(
                List.of("a", "b", "c"), List.of("a", "b"), List.of("a", "b", "c"))));
    }

    @Test
    public void testParseNumber() {
        assertEquals(Optional.of(42L), TableNormalizer.parseNumber(" 42 "));
        assertEquals(Optional.of(1000.0), TableNormalizer.parseNumber("1e3"));
        assertEquals(Optional.of(0.25), TableNormalizer.parseNumber(".25"));
        assertTrue(TableNormalizer.parseNumber("12abc").isEmpty());
        assertTrue(TableNormalizer.parseNumber("NaN").isEmpty());
        assertTrue(TableNormalizer.parseNumber("Infinity").isEmpty());
        assertTrue(TableNormalizer.parseNumber("-inf").isEmpty());
        assertTrue(TableNormalizer.parseNumber("1d").isEmpty());
    }
}
