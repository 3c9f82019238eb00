package com.textforge.formatter.html;

import com.textforge.formatter.core.FormatMode;
import com.textforge.formatter.core.IndentUnit;

public record HtmlFormatterConfig(
        FormatMode mode,
        int indentSize,
        IndentUnit indentUnit,
        boolean preserveComments,
        boolean sortAttributes,
        boolean selfCloseTags,
        boolean validate) {

    public HtmlFormatterConfig {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0");
        }
    }

    public static HtmlFormatterConfig defaults() {
        return new HtmlFormatterConfig(FormatMode.BEAUTIFY, 2, IndentUnit.SPACES, true, false, false, true);
    }

    public String indent() {
        return indentUnit.unit(indentSize);
    }
}
