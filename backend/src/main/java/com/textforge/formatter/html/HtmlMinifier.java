package com.textforge.formatter.html;

import java.util.List;

/**
 * Collapses whitespace in text, drops whitespace-only runs next to block-level tags
 * and removes comments unless they are to be preserved.
 */
public class HtmlMinifier {

    public String minify(List<MarkupToken> tokens, HtmlFormatterConfig config) {
        StringBuilder out = new StringBuilder();

        for (int i = 0; i < tokens.size(); i++) {
            MarkupToken token = tokens.get(i);
            switch (token.kind()) {
                case DOCTYPE -> out.append(token.text().strip());
                case COMMENT -> {
                    if (config.preserveComments()) {
                        out.append(token.text());
                    }
                }
                case OPEN_TAG, SELF_CLOSING_TAG, CLOSE_TAG -> out.append(TagRenderer.render(token, config));
                case RAW_TEXT -> out.append(token.text().strip());
                case TEXT -> {
                    String text = TagRenderer.collapseWhitespace(token.text());
                    if (text.isBlank()) {
                        if (!nextToBlock(tokens, i)) {
                            out.append(' ');
                        }
                    } else {
                        out.append(text);
                    }
                }
            }
        }
        return out.toString().strip();
    }

    private boolean nextToBlock(List<MarkupToken> tokens, int index) {
        MarkupToken before = index > 0 ? tokens.get(index - 1) : null;
        MarkupToken after = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
        return isBlockBoundary(before) || isBlockBoundary(after);
    }

    private boolean isBlockBoundary(MarkupToken token) {
        if (token == null) {
            return true;
        }
        return switch (token.kind()) {
            case OPEN_TAG, CLOSE_TAG, SELF_CLOSING_TAG -> HtmlElements.isBlock(token);
            case DOCTYPE, COMMENT, RAW_TEXT -> true;
            case TEXT -> false;
        };
    }
}
