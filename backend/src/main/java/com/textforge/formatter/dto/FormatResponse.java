package com.textforge.formatter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.core.FormatStats;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormatResponse(
        boolean success,
        String output,
        String error,
        String errorCode,
        FormatStats stats,
        List<Diagnostic> diagnostics) {

    public static FormatResponse from(FormatResult result) {
        return new FormatResponse(
                result.success(),
                result.output(),
                result.error(),
                result.errorCode(),
                result.stats(),
                result.diagnostics());
    }

    public static FormatResponse error(String errorCode, String error) {
        return new FormatResponse(
                false,
                null,
                error,
                errorCode,
                null,
                List.of());
    }
}
