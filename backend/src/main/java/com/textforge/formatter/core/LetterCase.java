package com.textforge.formatter.core;

import java.util.Locale;

public enum LetterCase {
    UPPER,
    LOWER,
    PRESERVE;

    public String apply(String text) {
        return switch (this) {
            case UPPER -> text.toUpperCase(Locale.ROOT);
            case LOWER -> text.toLowerCase(Locale.ROOT);
            case PRESERVE -> text;
        };
    }
}
