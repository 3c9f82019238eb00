package com.textforge.formatter.html;

import java.util.Set;

final class HtmlElements {

    static final Set<String> VOID = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    static final Set<String> INLINE = Set.of(
            "a", "abbr", "acronym", "b", "bdo", "big", "br", "button", "cite",
            "code", "dfn", "em", "i", "img", "input", "kbd", "label", "map",
            "object", "q", "samp", "select", "small", "span", "strong",
            "sub", "sup", "textarea", "time", "tt", "var");

    static final Set<String> RAW_TEXT = Set.of("script", "style");

    private HtmlElements() {
    }

    static boolean isBlock(MarkupToken token) {
        return token.name() != null && !INLINE.contains(token.name());
    }
}
