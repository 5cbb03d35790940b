package com.task.tablescan.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TableTest {

    private static Table sample() {
        return new Table(
                List.of("Name", ""),
                List.of(ColumnType.TEXT, ColumnType.NUMERIC),
                List.of(
                        Arrays.asList("Alice", 30L),
                        Arrays.asList("Bob", null)
                ));
    }

    @Test
    public void testColumnLabel_PositionalWhenBlank() {
        Table table = sample();

        assertEquals("Name", table.columnLabel(0));
        assertEquals("column_2", table.columnLabel(1));
    }

    @Test
    public void testToGrid_RendersMissingAsEmpty() {
        assertEquals(List.of(
                List.of("Name", ""),
                List.of("Alice", "30"),
                List.of("Bob", "")
        ), sample().toGrid().rows());
    }

    @Test
    public void testPreview() {
        assertEquals("Name   column_2\nAlice  30\nBob", sample().preview(5));
        assertEquals("Name   column_2\nAlice  30", sample().preview(1));
        assertEquals("No data", Table.empty().preview(5));
    }

    @Test
    public void testConstructor_RejectsRaggedRows() {
        assertThrows(IllegalArgumentException.class, () -> new Table(
                List.of("a", "b"),
                List.of(ColumnType.TEXT, ColumnType.TEXT),
                List.of(List.of("only one"))));
    }

    @Test
    public void testToken_TrimsAndValidates() {
        assertEquals("Age", new Token("  Age ", 1, 2, 0.5).text());
        assertThrows(IllegalArgumentException.class, () -> new Token("  ", 1, 2, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new Token("x", 1, 2, 1.5));
    }
}
