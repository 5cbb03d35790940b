package com.task.tablescan.model;

import java.util.List;

/**
 * Tokens returned by a locator chain, tagged with the backend that produced them.
 */
public record LocatedTokens(String backendName, List<Token> tokens) {

    public LocatedTokens {
        tokens = List.copyOf(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
