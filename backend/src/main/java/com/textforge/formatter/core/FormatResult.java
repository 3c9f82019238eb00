package com.textforge.formatter.core;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Outcome of one formatting call. A successful result always carries output;
 * structural problems in the source show up as diagnostics, not as failure.
 */
public record FormatResult(
        boolean success,
        String output,
        String error,
        String errorCode,
        FormatStats stats,
        List<Diagnostic> diagnostics) {

    public static final String EMPTY_INPUT = "empty-input";
    public static final String INPUT_TOO_LARGE = "input-too-large";
    public static final String INVALID_CONFIG = "invalid-config";
    public static final String INTERNAL_ERROR = "internal-error";

    public FormatResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static FormatResult success(String source, String output, List<Diagnostic> diagnostics,
            int statementCount, int elementCount, long processingTimeMs) {
        int inputSize = source.getBytes(StandardCharsets.UTF_8).length;
        int outputSize = output.getBytes(StandardCharsets.UTF_8).length;
        double ratio = inputSize > 0 ? (double) outputSize / inputSize : 1.0;
        int errors = (int) diagnostics.stream().filter(Diagnostic::isError).count();

        FormatStats stats = new FormatStats(
                inputSize,
                outputSize,
                ratio,
                FormatStats.lineCount(output),
                statementCount,
                elementCount,
                errors,
                diagnostics.size() - errors,
                processingTimeMs);
        return new FormatResult(true, output, null, null, stats, diagnostics);
    }

    public static FormatResult failure(String errorCode, String error) {
        return new FormatResult(false, null, error, errorCode, null, List.of());
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }
}
