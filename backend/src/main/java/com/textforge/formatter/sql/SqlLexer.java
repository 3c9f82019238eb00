package com.textforge.formatter.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Single forward scan that splits SQL source into classified tokens.
 * <p>
 * Never fails: whitespace and comments are kept as tokens, unterminated strings and
 * block comments run to the end of input, and any character nothing else claims becomes
 * a one-character {@link TokenKind#PUNCTUATION} token.
 */
public class SqlLexer {

    private final SqlDialect dialect;

    public SqlLexer(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public List<Token> tokenize(String source) {
        return new Scan(source).run();
    }

    /**
     * End index (exclusive) of the quoted literal opening at {@code start}, honoring backslash
     * escapes and doubled delimiters; {@code source.length()} when the literal is unterminated.
     */
    static QuotedSpan scanQuoted(String source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < source.length() && source.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return new QuotedSpan(i + 1, true);
                }
            } else {
                i++;
            }
        }
        return new QuotedSpan(source.length(), false);
    }

    record QuotedSpan(int end, boolean closed) {
    }

    private final class Scan {
        private final String src;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;
        private int line = 1;
        private int column = 1;

        Scan(String src) {
            this.src = src;
        }

        List<Token> run() {
            while (pos < src.length()) {
                int c = src.codePointAt(pos);

                if (Character.isWhitespace(c)) {
                    int end = pos;
                    while (end < src.length() && Character.isWhitespace(src.codePointAt(end))) {
                        end += Character.charCount(src.codePointAt(end));
                    }
                    emit(TokenKind.WHITESPACE, end);
                } else if (src.startsWith(dialect.lineCommentMarker(), pos)) {
                    int end = src.indexOf('\n', pos);
                    emit(TokenKind.COMMENT, end < 0 ? src.length() : end);
                } else if (src.startsWith(dialect.blockCommentOpen(), pos)) {
                    int close = src.indexOf(dialect.blockCommentClose(), pos + dialect.blockCommentOpen().length());
                    emit(TokenKind.COMMENT, close < 0 ? src.length() : close + dialect.blockCommentClose().length());
                } else if (dialect.isQuote(c)) {
                    emit(TokenKind.STRING_LITERAL, scanQuoted(src, pos).end());
                } else if (isNumberStart(c)) {
                    emit(TokenKind.NUMBER_LITERAL, scanNumber());
                } else if (c == '?') {
                    emit(TokenKind.LITERAL, pos + 1);
                } else if (dialect.isIdentifierStart(c)) {
                    int end = pos + Character.charCount(c);
                    while (end < src.length() && dialect.isIdentifierPart(src.codePointAt(end))) {
                        end += Character.charCount(src.codePointAt(end));
                    }
                    emit(dialect.classifyWord(src.substring(pos, end)), end);
                } else {
                    String operator = dialect.matchOperator(src, pos);
                    if (operator != null) {
                        emit(TokenKind.OPERATOR, pos + operator.length());
                    } else {
                        emit(TokenKind.PUNCTUATION, pos + Character.charCount(c));
                    }
                }
            }
            return tokens;
        }

        private boolean isNumberStart(int c) {
            if (isAsciiDigit(c)) {
                return true;
            }
            return c == '.' && pos + 1 < src.length() && isAsciiDigit(src.charAt(pos + 1));
        }

        private int scanNumber() {
            int end = pos;
            boolean seenDot = false;
            while (end < src.length()) {
                char c = src.charAt(end);
                if (isAsciiDigit(c)) {
                    end++;
                } else if (c == '.' && !seenDot) {
                    seenDot = true;
                    end++;
                } else {
                    break;
                }
            }

            // exponent only when digits actually follow, so "1e" stays a number and a word
            if (end < src.length() && (src.charAt(end) == 'e' || src.charAt(end) == 'E')) {
                int digits = end + 1;
                if (digits < src.length() && (src.charAt(digits) == '+' || src.charAt(digits) == '-')) {
                    digits++;
                }
                if (digits < src.length() && isAsciiDigit(src.charAt(digits))) {
                    end = digits;
                    while (end < src.length() && isAsciiDigit(src.charAt(end))) {
                        end++;
                    }
                }
            }
            return end;
        }

        private void emit(TokenKind kind, int end) {
            String text = src.substring(pos, end);
            tokens.add(new Token(kind, text, line, column));
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else if (!Character.isLowSurrogate(text.charAt(i))) {
                    column++;
                }
            }
            pos = end;
        }

        private boolean isAsciiDigit(int c) {
            return c >= '0' && c <= '9';
        }
    }
}
