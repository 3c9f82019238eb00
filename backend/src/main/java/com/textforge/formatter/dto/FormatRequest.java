package com.textforge.formatter.dto;

import jakarta.validation.constraints.NotNull;

/**
 * SQL formatting request. Every option is optional; enum-valued options are sent as
 * their lower-case names ({@code "beautify"}, {@code "upper"}, {@code "tabs"}, ...).
 */
public record FormatRequest(
        @NotNull(message = "Source code cannot be null")
        String sourceCode,
        String mode,
        Integer indentSize,
        String indentUnit,
        String keywordCase,
        String functionCase,
        String identifierCase,
        Integer blankLinesBetweenStatements,
        Boolean validate,
        Boolean breakAfterJoin,
        Boolean breakBeforeComma) {

    public static FormatRequest of(String sourceCode) {
        return new FormatRequest(sourceCode, null, null, null, null, null, null, null, null, null, null);
    }
}
