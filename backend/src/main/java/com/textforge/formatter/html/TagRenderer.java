package com.textforge.formatter.html;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class TagRenderer {

    private TagRenderer() {
    }

    static String render(MarkupToken token, HtmlFormatterConfig config) {
        if (token.kind() == MarkupKind.CLOSE_TAG) {
            return "</" + token.name() + ">";
        }

        StringBuilder sb = new StringBuilder("<").append(token.name());
        List<MarkupToken.Attribute> attributes = new ArrayList<>(token.attributes());
        if (config.sortAttributes()) {
            attributes.sort(Comparator.comparing(MarkupToken.Attribute::name));
        }
        for (MarkupToken.Attribute attribute : attributes) {
            sb.append(' ').append(attribute.name());
            if (attribute.value() != null) {
                char quote = attribute.value().indexOf('"') >= 0 ? '\'' : '"';
                sb.append('=').append(quote).append(attribute.value()).append(quote);
            }
        }

        if (token.kind() == MarkupKind.SELF_CLOSING_TAG
                && (config.selfCloseTags() || !HtmlElements.VOID.contains(token.name()))) {
            sb.append(" /");
        }
        return sb.append('>').toString();
    }

    static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ");
    }
}
