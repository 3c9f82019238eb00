package com.textforge.formatter.sql;

import com.textforge.formatter.core.FormatterConfig;

import java.util.List;

/**
 * Re-emits a SQL token stream with comments dropped and only the whitespace needed
 * to keep the text lexing to the same tokens.
 */
public class SqlMinifier {

    public String minify(List<Token> tokens, FormatterConfig config) {
        StringBuilder out = new StringBuilder();
        Token previous = null;

        for (Token token : tokens) {
            String value = switch (token.kind()) {
                case WHITESPACE, COMMENT -> null;
                case KEYWORD -> config.keywordCase().apply(token.text());
                case FUNCTION_NAME -> config.functionCase().apply(token.text());
                case IDENTIFIER -> config.identifierCase().apply(token.text());
                case OPERATOR, LITERAL, STRING_LITERAL, NUMBER_LITERAL, PUNCTUATION -> token.text();
            };
            if (value == null) {
                continue;
            }

            if (previous != null && needsSeparator(previous, token)) {
                out.append(' ');
            }
            out.append(value);
            previous = token;
        }
        return out.toString();
    }

    static boolean needsSeparator(Token left, Token right) {
        if (left.kind().isWordLike() && right.kind().isWordLike()) {
            return true;
        }
        // operators are matched longest-first, so "<" followed by "=" would re-lex as "<="
        if (left.is(TokenKind.OPERATOR) && right.is(TokenKind.OPERATOR)) {
            return true;
        }
        // 'a' 'b' would re-lex as one literal with a doubled quote
        if (left.is(TokenKind.STRING_LITERAL) && right.is(TokenKind.STRING_LITERAL)) {
            return true;
        }
        String joined = left.text().substring(left.text().length() - 1) + right.text().charAt(0);
        return joined.equals("--") || joined.equals("/*");
    }
}
