package com.textforge.formatter.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Editor highlighting request. Whitespace tokens are left out unless asked for.
 */
public record TokenizeRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 100_000, message = "Source code cannot exceed 100,000 characters")
        String sourceCode,
        Boolean includeWhitespace) {

    public static TokenizeRequest of(String sourceCode) {
        return new TokenizeRequest(sourceCode, null);
    }

    public boolean whitespaceIncluded() {
        return Boolean.TRUE.equals(includeWhitespace);
    }
}
