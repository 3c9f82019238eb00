package com.textforge.formatter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.FormatResult;

import java.util.List;

/**
 * Positioned tokens of one SQL source plus the lexer-level findings (unterminated
 * literals and comments) an editor can underline without a full validation pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenizeResponse(
        boolean success,
        String dialect,
        List<SyntaxToken> tokens,
        List<Diagnostic> diagnostics,
        String error,
        String errorCode,
        Long analysisTimeMs) {

    public static TokenizeResponse of(String dialect, List<SyntaxToken> tokens, List<Diagnostic> diagnostics,
            long analysisTimeMs) {
        return new TokenizeResponse(true, dialect, List.copyOf(tokens), List.copyOf(diagnostics),
                null, null, analysisTimeMs);
    }

    public static TokenizeResponse failure(String errorCode, String error) {
        return new TokenizeResponse(false, null, List.of(), List.of(), error, errorCode, null);
    }

    public static TokenizeResponse internalError(String error) {
        return failure(FormatResult.INTERNAL_ERROR, error);
    }
}
