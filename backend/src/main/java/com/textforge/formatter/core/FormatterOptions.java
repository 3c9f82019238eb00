package com.textforge.formatter.core;

import com.textforge.formatter.exception.InvalidFormatterConfigException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Parsing of option values that arrive as free text (request bodies, properties).
 * Unknown values are rejected, never coerced.
 */
public final class FormatterOptions {

    private FormatterOptions() {
    }

    public static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String value, E fallback)
            throws InvalidFormatterConfigException {
        if (value == null) {
            return fallback;
        }

        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // "tab" / "space" are accepted for the indent unit alongside the plural forms
        if (type == IndentUnit.class && (normalized.equals("TAB") || normalized.equals("SPACE"))) {
            normalized = normalized + "S";
        }

        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }

        String allowed = Arrays.stream(type.getEnumConstants())
                .map(c -> c.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        throw new InvalidFormatterConfigException(field,
                "Invalid value '" + value + "' for " + field + " (expected one of: " + allowed + ")");
    }

    public static int parseNonNegative(String field, Integer value, int fallback)
            throws InvalidFormatterConfigException {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            throw new InvalidFormatterConfigException(field,
                    "Invalid value " + value + " for " + field + " (must be >= 0)");
        }
        return value;
    }
}
