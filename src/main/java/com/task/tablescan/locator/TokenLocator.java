package com.task.tablescan.locator;

import com.task.tablescan.model.Token;

import java.nio.file.Path;
import java.util.List;

/**
 * An OCR backend that turns an image into positioned word tokens.
 *
 * <p>Implementations return tokens in top-to-bottom reading order, with blank
 * text and low-confidence words already removed. Row clustering relies on that
 * order and does not re-sort.</p>
 */
public interface TokenLocator {

    String name();

    List<Token> locate(Path image) throws Exception;
}
