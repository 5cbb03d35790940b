package com.task.tablescan.model;

/**
 * A token placed in a row. {@code tokenIndex} is the token's position in the
 * locator output, so later stages can refer back to it by identity.
 */
public record RowCell(int tokenIndex, String text, int x, double confidence) {
}
