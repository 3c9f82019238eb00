package com.textforge.formatter.html;

import java.util.List;

/**
 * One piece of markup. {@code name} and {@code attributes} are only set for tags;
 * {@code text} is always the exact source substring.
 */
public record MarkupToken(
        MarkupKind kind,
        String text,
        String name,
        List<Attribute> attributes,
        int line,
        int column) {

    public MarkupToken {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public boolean isTag() {
        return kind == MarkupKind.OPEN_TAG || kind == MarkupKind.CLOSE_TAG || kind == MarkupKind.SELF_CLOSING_TAG;
    }

    public boolean isElementStart() {
        return kind == MarkupKind.OPEN_TAG || kind == MarkupKind.SELF_CLOSING_TAG;
    }

    /**
     * @param name  lower-cased attribute name
     * @param value unquoted value, {@code null} for a bare attribute
     */
    public record Attribute(String name, String value) {
    }
}
