package com.textforge.formatter.html;

import java.util.ArrayList;
import java.util.List;

/**
 * Puts block-level elements on their own lines, indented by nesting depth, and keeps
 * inline elements and text flowing on the current line.
 */
public class HtmlBeautifier {

    public String beautify(List<MarkupToken> tokens, HtmlFormatterConfig config) {
        String indent = config.indent();
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int lineDepth = 0;
        boolean pendingSpace = false;

        for (MarkupToken token : tokens) {
            switch (token.kind()) {
                case DOCTYPE -> {
                    flush(lines, current, indent, lineDepth);
                    lines.add(indent.repeat(depth) + token.text().strip());
                }
                case COMMENT -> {
                    if (config.preserveComments()) {
                        flush(lines, current, indent, lineDepth);
                        lines.add(indent.repeat(depth) + token.text().strip());
                    }
                }
                case OPEN_TAG, SELF_CLOSING_TAG -> {
                    String tag = TagRenderer.render(token, config);
                    if (HtmlElements.isBlock(token)) {
                        flush(lines, current, indent, lineDepth);
                        lines.add(indent.repeat(depth) + tag);
                        if (token.kind() == MarkupKind.OPEN_TAG) {
                            depth++;
                        }
                    } else {
                        if (current.length() == 0) {
                            lineDepth = depth;
                        } else if (pendingSpace) {
                            current.append(' ');
                        }
                        current.append(tag);
                    }
                    pendingSpace = false;
                }
                case CLOSE_TAG -> {
                    String tag = TagRenderer.render(token, config);
                    if (HtmlElements.isBlock(token)) {
                        flush(lines, current, indent, lineDepth);
                        depth = Math.max(0, depth - 1);
                        lines.add(indent.repeat(depth) + tag);
                    } else {
                        if (current.length() == 0) {
                            lineDepth = depth;
                        } else if (pendingSpace) {
                            current.append(' ');
                        }
                        current.append(tag);
                    }
                    pendingSpace = false;
                }
                case TEXT -> {
                    String text = TagRenderer.collapseWhitespace(token.text());
                    String trimmed = text.strip();
                    if (trimmed.isEmpty()) {
                        pendingSpace = !text.isEmpty();
                        continue;
                    }
                    if (current.length() == 0) {
                        lineDepth = depth;
                    } else if (pendingSpace || text.startsWith(" ")) {
                        current.append(' ');
                    }
                    current.append(trimmed);
                    pendingSpace = text.endsWith(" ");
                }
                case RAW_TEXT -> {
                    flush(lines, current, indent, lineDepth);
                    for (String rawLine : token.text().split("\n")) {
                        if (!rawLine.isBlank()) {
                            lines.add(indent.repeat(depth) + rawLine.strip());
                        }
                    }
                    pendingSpace = false;
                }
            }
        }
        flush(lines, current, indent, lineDepth);

        return String.join("\n", lines).strip();
    }

    private void flush(List<String> lines, StringBuilder current, String indent, int depth) {
        String content = current.toString().strip();
        if (!content.isEmpty()) {
            lines.add(indent.repeat(depth) + content);
        }
        current.setLength(0);
    }
}
