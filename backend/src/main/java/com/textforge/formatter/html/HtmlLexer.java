package com.textforge.formatter.html;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits HTML into tags, comments and text runs. Like the SQL lexer it never fails:
 * a {@code <} that does not open a well-formed tag is kept as text, and an unterminated
 * comment runs to the end of input.
 */
public class HtmlLexer {

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "([^\\s=/>\"']+)(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>\"']+)))?");

    public List<MarkupToken> tokenize(String source) {
        List<MarkupToken> tokens = new ArrayList<>();
        Cursor cursor = new Cursor(source);

        while (cursor.pos < source.length()) {
            int start = cursor.pos;
            char c = source.charAt(start);

            if (c == '<' && source.startsWith("<!--", start)) {
                int close = source.indexOf("-->", start + 4);
                int end = close < 0 ? source.length() : close + 3;
                tokens.add(cursor.emit(MarkupKind.COMMENT, end, null, null));
            } else if (c == '<' && opensTag(source, start)) {
                int end = findTagEnd(source, start);
                if (end < 0) {
                    tokens.add(cursor.emit(MarkupKind.TEXT, start + 1, null, null));
                    continue;
                }
                MarkupToken tag = parseTag(cursor, end);
                tokens.add(tag);

                if (tag.kind() == MarkupKind.OPEN_TAG && HtmlElements.RAW_TEXT.contains(tag.name())) {
                    int rawEnd = indexOfIgnoreCase(source, "</" + tag.name(), cursor.pos);
                    if (rawEnd < 0) {
                        rawEnd = source.length();
                    }
                    if (rawEnd > cursor.pos) {
                        tokens.add(cursor.emit(MarkupKind.RAW_TEXT, rawEnd, null, null));
                    }
                }
            } else {
                int end = source.indexOf('<', start + 1);
                tokens.add(cursor.emit(MarkupKind.TEXT, end < 0 ? source.length() : end, null, null));
            }
        }
        return tokens;
    }

    private boolean opensTag(String source, int start) {
        if (start + 1 >= source.length()) {
            return false;
        }
        char next = source.charAt(start + 1);
        return Character.isLetter(next) || next == '/' || next == '!' || next == '?';
    }

    /** Index just past the closing {@code >}, skipping quoted attribute values; -1 if none. */
    private int findTagEnd(String source, int start) {
        char quote = 0;
        for (int i = start + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            } else if (c == '<') {
                return -1;
            }
        }
        return -1;
    }

    private MarkupToken parseTag(Cursor cursor, int end) {
        String raw = cursor.source.substring(cursor.pos, end);
        String content = raw.substring(1, raw.length() - 1).trim();

        if (content.startsWith("!") || content.startsWith("?")) {
            return cursor.emit(MarkupKind.DOCTYPE, end, null, null);
        }

        if (content.startsWith("/")) {
            String name = content.substring(1).trim().toLowerCase(Locale.ROOT);
            return cursor.emit(MarkupKind.CLOSE_TAG, end, name, null);
        }

        boolean explicitSelfClose = content.endsWith("/");
        if (explicitSelfClose) {
            content = content.substring(0, content.length() - 1).trim();
        }

        int nameEnd = 0;
        while (nameEnd < content.length()
                && !Character.isWhitespace(content.charAt(nameEnd)) && content.charAt(nameEnd) != '/') {
            nameEnd++;
        }
        String name = content.substring(0, nameEnd).toLowerCase(Locale.ROOT);
        List<MarkupToken.Attribute> attributes = parseAttributes(content.substring(nameEnd));

        MarkupKind kind = explicitSelfClose || HtmlElements.VOID.contains(name)
                ? MarkupKind.SELF_CLOSING_TAG
                : MarkupKind.OPEN_TAG;
        return cursor.emit(kind, end, name, attributes);
    }

    private List<MarkupToken.Attribute> parseAttributes(String attributeText) {
        List<MarkupToken.Attribute> attributes = new ArrayList<>();
        Matcher matcher = ATTRIBUTE.matcher(attributeText);
        while (matcher.find()) {
            String name = matcher.group(1).toLowerCase(Locale.ROOT);
            String value = matcher.group(2) != null ? matcher.group(2)
                    : matcher.group(3) != null ? matcher.group(3)
                    : matcher.group(4);
            attributes.add(new MarkupToken.Attribute(name, value));
        }
        return attributes;
    }

    private static int indexOfIgnoreCase(String source, String needle, int from) {
        for (int i = from; i <= source.length() - needle.length(); i++) {
            if (source.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static final class Cursor {
        private final String source;
        private int pos;
        private int line = 1;
        private int column = 1;

        Cursor(String source) {
            this.source = source;
        }

        MarkupToken emit(MarkupKind kind, int end, String name, List<MarkupToken.Attribute> attributes) {
            String text = source.substring(pos, end);
            MarkupToken token = new MarkupToken(kind, text, name, attributes, line, column);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else if (!Character.isLowSurrogate(text.charAt(i))) {
                    column++;
                }
            }
            pos = end;
            return token;
        }
    }
}
