package com.textforge.formatter.sql;

import java.util.Locale;

/**
 * One lexed piece of SQL source. {@code text} is the exact source substring, so the
 * concatenated texts of a token stream reproduce the input.
 *
 * @param kind   token class
 * @param text   source text, original casing
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenKind kind, String text, int line, int column) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isKeyword(String upperCaseWord) {
        return kind == TokenKind.KEYWORD && text.equalsIgnoreCase(upperCaseWord);
    }

    public boolean isPunctuation(char c) {
        return kind == TokenKind.PUNCTUATION && text.length() == 1 && text.charAt(0) == c;
    }

    public boolean isSignificant() {
        return kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT;
    }

    public boolean isLineComment() {
        return kind == TokenKind.COMMENT && !text.startsWith("/*");
    }

    /** A keyword whose following identifier names a table ({@code FROM}, {@code JOIN}, ...). */
    public boolean isTableMarker() {
        return kind == TokenKind.KEYWORD && SqlClauses.TABLE_MARKERS.contains(upper());
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public int endLine() {
        int end = line;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                end++;
            }
        }
        return end;
    }

    /** 1-based column just past the last character, counted in code points like {@link #column()}. */
    public int endColumn() {
        int lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            return column + text.codePointCount(0, text.length());
        }
        return text.codePointCount(lastNewline + 1, text.length()) + 1;
    }
}
