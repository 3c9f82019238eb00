package com.textforge.formatter.sql;

import java.util.List;
import java.util.Set;

/**
 * Keyword groups that drive layout and validation, plus small helpers over token lists.
 */
final class SqlClauses {

    /** Clause keywords that always start a new line. */
    static final Set<String> MAJOR = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT",
            "UNION", "INTERSECT", "EXCEPT", "VALUES", "SET");

    static final Set<String> JOIN_MODIFIERS = Set.of("INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL");

    static final Set<String> JOIN_CLASS = Set.of("JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL");

    /** Keywords whose following identifier names a table. */
    static final Set<String> TABLE_MARKERS = Set.of("FROM", "JOIN", "INTO", "UPDATE");

    private SqlClauses() {
    }

    static boolean isOpenBracket(Token token) {
        return token.isPunctuation('(') || token.isPunctuation('[') || token.isPunctuation('{');
    }

    static boolean isCloseBracket(Token token) {
        return token.isPunctuation(')') || token.isPunctuation(']') || token.isPunctuation('}');
    }

    static char closerOf(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    static Token nextSignificant(List<Token> tokens, int from) {
        for (int i = from + 1; i < tokens.size(); i++) {
            if (tokens.get(i).isSignificant()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    static int countStatements(List<Token> tokens) {
        int statements = 0;
        int depth = 0;
        boolean open = false;
        for (Token token : tokens) {
            if (!token.isSignificant()) {
                continue;
            }
            if (isOpenBracket(token)) {
                depth++;
            } else if (isCloseBracket(token)) {
                depth = Math.max(0, depth - 1);
            }

            if (token.isPunctuation(';') && depth == 0) {
                if (open) {
                    statements++;
                }
                open = false;
            } else {
                open = true;
            }
        }
        return open ? statements + 1 : statements;
    }

    static int countTableReferences(List<Token> tokens) {
        int tables = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTableMarker()) {
                Token next = nextSignificant(tokens, i);
                if (next != null && next.is(TokenKind.IDENTIFIER)) {
                    tables++;
                }
            }
        }
        return tables;
    }
}
