package com.textforge.formatter.sql;

public enum TokenKind {
    KEYWORD,
    FUNCTION_NAME,
    IDENTIFIER,
    OPERATOR,
    /** Positional bind placeholder ({@code ?}). */
    LITERAL,
    STRING_LITERAL,
    NUMBER_LITERAL,
    COMMENT,
    PUNCTUATION,
    WHITESPACE;

    /** Kinds that would merge into one token on re-lexing when written back to back. */
    public boolean isWordLike() {
        return switch (this) {
            case KEYWORD, IDENTIFIER, FUNCTION_NAME, NUMBER_LITERAL -> true;
            case OPERATOR, LITERAL, STRING_LITERAL, COMMENT, PUNCTUATION, WHITESPACE -> false;
        };
    }
}
