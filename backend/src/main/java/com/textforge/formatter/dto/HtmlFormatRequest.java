package com.textforge.formatter.dto;

import jakarta.validation.constraints.NotNull;

public record HtmlFormatRequest(
        @NotNull(message = "Source code cannot be null")
        String sourceCode,
        String mode,
        Integer indentSize,
        String indentUnit,
        Boolean preserveComments,
        Boolean sortAttributes,
        Boolean selfCloseTags,
        Boolean validate) {

    public static HtmlFormatRequest of(String sourceCode) {
        return new HtmlFormatRequest(sourceCode, null, null, null, null, null, null, null);
    }
}
