package com.task.tablescan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a reconstruct call: tokens located elsewhere, plus the name of the
 * backend that produced them.
 */
public record ReconstructRequest(
        @JsonProperty("backend_name")
        String backendName,

        @JsonProperty("tokens")
        List<TokenPayload> tokens
) {

    public record TokenPayload(
            @JsonProperty("text")
            String text,

            @JsonProperty("y")
            Integer y,

            @JsonProperty("x")
            Integer x,

            @JsonProperty("confidence")
            Double confidence
    ) {}

    public List<Token> toTokens() {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens is required");
        }
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            TokenPayload t = tokens.get(i);
            if (t == null || t.y() == null || t.x() == null || t.confidence() == null) {
                throw new IllegalArgumentException("tokens[" + i + "] needs text, y, x and confidence");
            }
            result.add(new Token(t.text(), t.y(), t.x(), t.confidence()));
        }
        return result;
    }
}
