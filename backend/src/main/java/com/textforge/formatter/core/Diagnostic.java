package com.textforge.formatter.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single validation finding, positioned at the token that triggered it.
 *
 * @param severity   error or warning
 * @param code       short stable identifier, e.g. {@code unclosed-paren}
 * @param message    human-readable description
 * @param line       1-based line of the triggering token
 * @param column     1-based column of the triggering token
 * @param suggestion optional hint on how to fix the finding
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        Severity severity,
        String code,
        String message,
        int line,
        int column,
        String suggestion) {

    public static Diagnostic error(String code, String message, int line, int column) {
        return new Diagnostic(Severity.ERROR, code, message, line, column, null);
    }

    public static Diagnostic error(String code, String message, int line, int column, String suggestion) {
        return new Diagnostic(Severity.ERROR, code, message, line, column, suggestion);
    }

    public static Diagnostic warning(String code, String message, int line, int column) {
        return new Diagnostic(Severity.WARNING, code, message, line, column, null);
    }

    public static Diagnostic warning(String code, String message, int line, int column, String suggestion) {
        return new Diagnostic(Severity.WARNING, code, message, line, column, suggestion);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
