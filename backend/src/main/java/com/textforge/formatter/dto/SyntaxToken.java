package com.textforge.formatter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Editor-facing view of a lexed token. Columns are 1-based; the end position points
 * just past the last character.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {
}
