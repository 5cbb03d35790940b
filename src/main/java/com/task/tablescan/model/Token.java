package com.task.tablescan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recognized word with its pixel position and recognition confidence,
 * as produced by a {@link com.task.tablescan.locator.TokenLocator}.
 */
public record Token(
        @JsonProperty("text")
        String text,

        @JsonProperty("y")
        int y,

        @JsonProperty("x")
        int x,

        @JsonProperty("confidence")
        double confidence
) {

    public Token {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Token text must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Token confidence must be in [0,1], got " + confidence);
        }
        text = text.trim();
    }
}
