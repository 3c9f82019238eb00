package com.textforge.formatter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@ConfigurationProperties(prefix = "textforge.formatter")
@Validated
public record FormatterProperties(
    @NotNull
    @Positive
    Integer maxSourceLength,

    @NotNull
    @PositiveOrZero
    Integer defaultIndentSize,

    @NotNull
    @PositiveOrZero
    Integer defaultBlankLines,

    @NotNull
    Boolean validateByDefault,

    @NotBlank
    String sqlDialect
) {

    public static FormatterProperties defaults() {
        return new FormatterProperties(
            100_000,
            4,
            1,
            true,
            "standard"
        );
    }
}
