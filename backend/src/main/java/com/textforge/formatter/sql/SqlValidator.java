package com.textforge.formatter.sql;

import com.textforge.formatter.core.Diagnostic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lint-style structural checks over a SQL token stream.
 * <p>
 * Findings are never deduplicated: two checks tripping over the same construct both
 * report. Diagnostics come back in source order, with unclosed brackets appended last.
 */
public class SqlValidator {

    private static final List<InjectionPattern> INJECTION_PATTERNS = List.of(
            new InjectionPattern(
                    Pattern.compile("\\bOR\\s+'([^'\\s]*)'\\s*=\\s*'\\1(?:'|\\s*$|\\s*--)", Pattern.CASE_INSENSITIVE),
                    "Tautological OR comparison of identical string literals"),
            new InjectionPattern(
                    Pattern.compile("\\bOR\\s+(\\d+)\\s*=\\s*\\1\\b(?!\\s*[.\\d])", Pattern.CASE_INSENSITIVE),
                    "Tautological OR comparison of identical numbers"),
            new InjectionPattern(
                    Pattern.compile("'\\s*;\\s*DROP\\s+TABLE\\b", Pattern.CASE_INSENSITIVE),
                    "Quoted value terminated by a DROP TABLE statement"),
            new InjectionPattern(
                    Pattern.compile("'\\s*UNION\\s+(?:ALL\\s+)?SELECT\\b[^;]*?(?:--|/\\*)", Pattern.CASE_INSENSITIVE),
                    "Quoted value followed by UNION SELECT and a trailing comment"));

    private static final String INJECTION_SUGGESTION = "Use parameterized queries or prepared statements";

    public List<Diagnostic> validate(List<Token> tokens) {
        Pass pass = new Pass(tokens);
        pass.run();
        return pass.result();
    }

    /**
     * Only the findings that need no parsing context: literals and block comments left
     * open at end of input.
     */
    public List<Diagnostic> lexicalFindings(List<Token> tokens) {
        List<Diagnostic> findings = new ArrayList<>();
        for (Token token : tokens) {
            checkUnterminated(token, findings);
        }
        return findings;
    }

    private static void checkUnterminated(Token token, List<Diagnostic> out) {
        String text = token.text();
        if (token.is(TokenKind.COMMENT)) {
            if (text.startsWith("/*") && (text.length() < 4 || !text.endsWith("*/"))) {
                out.add(Diagnostic.warning("unclosed-comment",
                        "Block comment is not closed before end of input", token.line(), token.column(),
                        "Add '*/' to close the comment"));
            }
        } else if (token.is(TokenKind.STRING_LITERAL) && !SqlLexer.scanQuoted(text, 0).closed()) {
            out.add(Diagnostic.warning("unclosed-string",
                    "Quoted literal is not closed before end of input", token.line(), token.column(),
                    "Add the closing " + text.charAt(0)));
        }
    }

    private record InjectionPattern(Pattern pattern, String description) {
    }

    private static final class SelectScope {
        final Token select;
        final int depth;
        boolean hasFrom;

        SelectScope(Token select, int depth) {
            this.select = select;
            this.depth = depth;
        }
    }

    private record JoinScope(Token join, int depth) {
    }

    private static final class Pass {
        private final List<Token> tokens;
        private final List<Diagnostic> inline = new ArrayList<>();
        private final List<Diagnostic> trailing = new ArrayList<>();

        private final List<Token> brackets = new ArrayList<>();
        private final Deque<SelectScope> selects = new ArrayDeque<>();
        private final Deque<JoinScope> joins = new ArrayDeque<>();
        private Token orderBy;
        private boolean hasLimit;
        private Token previous;

        Pass(List<Token> tokens) {
            this.tokens = tokens;
        }

        void run() {
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                switch (token.kind()) {
                    case WHITESPACE -> {
                        continue;
                    }
                    case COMMENT, STRING_LITERAL -> checkUnterminated(token, inline);
                    case KEYWORD -> onKeyword(token, i);
                    case PUNCTUATION -> onPunctuation(token);
                    case FUNCTION_NAME, IDENTIFIER, OPERATOR, LITERAL, NUMBER_LITERAL -> {
                    }
                }
                if (token.isSignificant()) {
                    previous = token;
                }
            }

            endStatement();
            for (Token open : brackets) {
                trailing.add(Diagnostic.error("unclosed-paren",
                        "Unclosed '" + open.text() + "'", open.line(), open.column(),
                        "Add the matching '" + SqlClauses.closerOf(open.text().charAt(0)) + "'"));
            }
            scanInjectionPatterns();
        }

        List<Diagnostic> result() {
            List<Diagnostic> ordered = new ArrayList<>(inline);
            ordered.sort(Comparator.comparingInt(Diagnostic::line).thenComparingInt(Diagnostic::column));
            ordered.addAll(trailing);
            return ordered;
        }

        private int depth() {
            return brackets.size();
        }

        private void onKeyword(Token token, int index) {
            String word = token.upper();
            switch (word) {
                case "SELECT" -> {
                    resolveSelects(depth());
                    selects.push(new SelectScope(token, depth()));
                }
                case "FROM" -> {
                    SelectScope scope = selects.peek();
                    if (scope != null && scope.depth == depth()) {
                        scope.hasFrom = true;
                    }
                    resolveJoins(depth());
                }
                case "UNION", "INTERSECT", "EXCEPT" -> {
                    resolveSelects(depth());
                    resolveJoins(depth());
                }
                case "JOIN" -> {
                    resolveJoins(depth());
                    boolean unconditional = previous != null && previous.is(TokenKind.KEYWORD)
                            && (previous.isKeyword("CROSS") || previous.isKeyword("NATURAL"));
                    if (!unconditional) {
                        joins.push(new JoinScope(token, depth()));
                    }
                }
                case "ON", "USING" -> {
                    JoinScope join = joins.peek();
                    if (join != null && join.depth() == depth()) {
                        joins.pop();
                    }
                }
                case "WHERE", "GROUP", "HAVING", "LIMIT", "ORDER" -> {
                    resolveJoins(depth());
                    if (word.equals("LIMIT")) {
                        hasLimit |= depth() == 0;
                    } else if (word.equals("ORDER") && orderBy == null && depth() == 0) {
                        Token next = SqlClauses.nextSignificant(tokens, index);
                        if (next != null && next.isKeyword("BY")) {
                            orderBy = token;
                        }
                    }
                }
                case "FETCH" -> hasLimit |= depth() == 0;
                case "LIKE", "ILIKE" -> checkLikePattern(token, index);
                default -> {
                }
            }
        }

        private void onPunctuation(Token token) {
            if (SqlClauses.isOpenBracket(token)) {
                brackets.add(token);
            } else if (SqlClauses.isCloseBracket(token)) {
                if (brackets.isEmpty()) {
                    inline.add(Diagnostic.error("unexpected-closing-paren",
                            "Unexpected closing '" + token.text() + "'", token.line(), token.column(),
                            "Remove it or add the matching opening bracket"));
                    return;
                }

                Token open = brackets.remove(brackets.size() - 1);
                char expected = SqlClauses.closerOf(open.text().charAt(0));
                if (token.text().charAt(0) != expected) {
                    inline.add(Diagnostic.error("mismatched-bracket",
                            "Expected '" + expected + "' to close '" + open.text() + "' opened at line "
                                    + open.line() + ", column " + open.column() + " but found '" + token.text() + "'",
                            token.line(), token.column()));
                }
                resolveSelects(depth() + 1);
                resolveJoins(depth() + 1);
            } else if (token.isPunctuation(';')) {
                endStatement();
            }
        }

        private void endStatement() {
            resolveSelects(0);
            resolveJoins(0);
            if (orderBy != null && !hasLimit) {
                inline.add(Diagnostic.warning("order-without-limit",
                        "ORDER BY without LIMIT may sort more rows than needed",
                        orderBy.line(), orderBy.column(),
                        "Consider adding a LIMIT clause if you only need the top rows"));
            }
            orderBy = null;
            hasLimit = false;
        }

        /** Closes every SELECT opened at {@code minDepth} or deeper. */
        private void resolveSelects(int minDepth) {
            while (!selects.isEmpty() && selects.peek().depth >= minDepth) {
                SelectScope scope = selects.pop();
                if (!scope.hasFrom) {
                    inline.add(Diagnostic.warning("missing-from-clause",
                            "SELECT statement missing FROM clause",
                            scope.select.line(), scope.select.column(),
                            "Add a FROM clause unless the query selects constant expressions only"));
                }
            }
        }

        private void resolveJoins(int minDepth) {
            Iterator<JoinScope> it = joins.iterator();
            while (it.hasNext()) {
                JoinScope scope = it.next();
                if (scope.depth() >= minDepth) {
                    it.remove();
                    inline.add(Diagnostic.warning("join-without-condition",
                            "JOIN without ON or USING produces a Cartesian product",
                            scope.join().line(), scope.join().column(),
                            "Add an ON or USING condition, or write CROSS JOIN if the product is intended"));
                }
            }
        }

        private void checkLikePattern(Token like, int index) {
            Token pattern = SqlClauses.nextSignificant(tokens, index);
            if (pattern != null && pattern.is(TokenKind.STRING_LITERAL)
                    && pattern.text().length() > 1 && pattern.text().charAt(1) == '%') {
                inline.add(Diagnostic.warning("leading-wildcard",
                        like.upper() + " pattern starting with % cannot use an index",
                        pattern.line(), pattern.column(),
                        "Avoid leading wildcards in LIKE patterns when possible"));
            }
        }

        private void scanInjectionPatterns() {
            StringBuilder text = new StringBuilder();
            for (Token token : tokens) {
                text.append(token.text());
            }

            for (InjectionPattern injection : INJECTION_PATTERNS) {
                Matcher matcher = injection.pattern().matcher(text);
                if (matcher.find()) {
                    int[] position = positionOf(text, matcher.start());
                    inline.add(Diagnostic.error("sql-injection",
                            "Potential SQL injection pattern: " + injection.description(),
                            position[0], position[1], INJECTION_SUGGESTION));
                }
            }
        }

        private int[] positionOf(CharSequence text, int offset) {
            int line = 1;
            int column = 1;
            for (int i = 0; i < offset; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else if (!Character.isLowSurrogate(text.charAt(i))) {
                    column++;
                }
            }
            return new int[] { line, column };
        }
    }
}
