package com.textforge.formatter.sql;

import com.textforge.formatter.core.FormatterConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Re-emits a SQL token stream with clause-oriented line breaks, bracket-driven
 * indentation and per-class letter case.
 * <p>
 * Clause keywords start a new line, SELECT lists put one column per line aligned under
 * the first column, and the contents of a bracket are indented one level deeper.
 * Formatting already formatted output is a no-op.
 */
public class SqlBeautifier {

    private static final Set<String> VALUE_KEYWORDS = Set.of("NULL", "TRUE", "FALSE", "END");

    public String beautify(List<Token> tokens, FormatterConfig config) {
        Layout layout = new Layout(config);
        for (int i = 0; i < tokens.size(); i++) {
            layout.accept(tokens, i);
        }
        return layout.finish();
    }

    private static final class SelectList {
        final int depth;
        final int levelAtSelect;
        final String continuationPrefix;
        boolean started;

        SelectList(int depth, int levelAtSelect, String continuationPrefix) {
            this.depth = depth;
            this.levelAtSelect = levelAtSelect;
            this.continuationPrefix = continuationPrefix;
        }
    }

    /**
     * Output accumulated so far plus the layout state that decides where the next
     * token lands. One instance per {@link #beautify} call.
     */
    static final class Layout {
        private final FormatterConfig config;
        private final String indent;
        private final List<String> lines = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private final Deque<Boolean> brackets = new ArrayDeque<>();
        private final Deque<SelectList> selectLists = new ArrayDeque<>();

        private String linePrefix = "";
        private boolean pendingSpace;
        private int indentLevel;
        private Token previous;

        Layout(FormatterConfig config) {
            this.config = config;
            this.indent = config.indent();
        }

        void accept(List<Token> tokens, int index) {
            Token token = tokens.get(index);
            // tokens that would merge on re-lexing keep a space, as in minified output
            if (token.isSignificant() && previous != null && SqlMinifier.needsSeparator(previous, token)) {
                pendingSpace = true;
            }
            switch (token.kind()) {
                case WHITESPACE -> {
                    if (token.text().indexOf('\n') >= 0) {
                        flushLine();
                    } else {
                        pendingSpace = true;
                    }
                }
                case COMMENT -> {
                    if (token.isLineComment()) {
                        flushLine();
                        lines.add(currentPrefix() + token.text().strip());
                        markStarted();
                    } else {
                        pendingSpace = true;
                        append(token.text());
                    }
                }
                case KEYWORD -> keyword(tokens, index);
                case FUNCTION_NAME -> append(config.functionCase().apply(token.text()));
                case IDENTIFIER -> append(config.identifierCase().apply(token.text()));
                case OPERATOR -> operator(token);
                case LITERAL, STRING_LITERAL, NUMBER_LITERAL -> append(token.text());
                case PUNCTUATION -> punctuation(token);
            }

            if (token.isSignificant()) {
                previous = token;
            }
        }

        String finish() {
            flushLine();

            List<String> collapsed = new ArrayList<>(lines.size());
            boolean lastBlank = true;
            for (String line : lines) {
                boolean blank = line.isBlank();
                if (blank && lastBlank) {
                    continue;
                }
                collapsed.add(blank ? "" : line);
                lastBlank = blank;
            }
            while (!collapsed.isEmpty() && collapsed.get(collapsed.size() - 1).isEmpty()) {
                collapsed.remove(collapsed.size() - 1);
            }
            // trailing whitespace can belong to an unterminated literal, so only blank lines are trimmed
            return String.join("\n", collapsed);
        }

        private void keyword(List<Token> tokens, int index) {
            Token token = tokens.get(index);
            String word = token.upper();
            String value = config.keywordCase().apply(token.text());

            if (SqlClauses.MAJOR.contains(word) && !insideCall()) {
                flushLine();
                closeSelectLists(depth());
                append(value);
                if (word.equals("SELECT")) {
                    selectLists.push(new SelectList(depth(), indentLevel,
                            linePrefix + " ".repeat(value.length() + 1)));
                }
            } else if (config.breakAfterJoin() && SqlClauses.JOIN_CLASS.contains(word) && !insideCall()
                    && !followsJoinModifier() && !isCallee(tokens, index)) {
                flushLine();
                closeSelectLists(depth());
                append(value);
            } else {
                append(value);
            }
        }

        private void operator(Token token) {
            if (isBinaryOperand(previous)) {
                pendingSpace = true;
                append(token.text());
                pendingSpace = true;
            } else {
                append(token.text());
            }
        }

        private void punctuation(Token token) {
            switch (token.text().charAt(0)) {
                case '(', '[', '{' -> {
                    boolean call = previous != null
                            && (previous.is(TokenKind.FUNCTION_NAME) || previous.is(TokenKind.IDENTIFIER));
                    append(token.text());
                    brackets.push(call);
                    indentLevel++;
                }
                case ')', ']', '}' -> {
                    indentLevel = Math.max(0, indentLevel - 1);
                    if (!brackets.isEmpty()) {
                        brackets.pop();
                    }
                    while (!selectLists.isEmpty() && selectLists.peek().depth > depth()) {
                        selectLists.pop();
                    }
                    append(token.text());
                }
                case ',' -> {
                    pendingSpace = false;
                    SelectList list = selectLists.peek();
                    if (list != null && list.depth == depth()) {
                        if (config.breakBeforeComma()) {
                            flushLine();
                            append(",");
                            pendingSpace = true;
                        } else {
                            append(",");
                            flushLine();
                        }
                    } else {
                        append(",");
                        pendingSpace = true;
                    }
                }
                case ';' -> {
                    pendingSpace = false;
                    append(";");
                    flushLine();
                    selectLists.clear();
                    for (int i = 0; i < config.blankLinesBetweenStatements(); i++) {
                        lines.add("");
                    }
                }
                default -> append(token.text());
            }
        }

        private void append(String text) {
            if (current.length() == 0) {
                linePrefix = currentPrefix();
            } else if (pendingSpace && current.charAt(current.length() - 1) != ' ') {
                current.append(' ');
            }
            current.append(text);
            pendingSpace = false;
        }

        private void flushLine() {
            String content = current.toString();
            if (!content.isEmpty()) {
                lines.add(linePrefix + content);
                markStarted();
            }
            current.setLength(0);
            pendingSpace = false;
        }

        private void markStarted() {
            SelectList list = selectLists.peek();
            if (list != null) {
                list.started = true;
            }
        }

        private String currentPrefix() {
            SelectList list = selectLists.peek();
            if (list != null && list.started) {
                return list.continuationPrefix + indent.repeat(Math.max(0, indentLevel - list.levelAtSelect));
            }
            return indent.repeat(indentLevel);
        }

        private void closeSelectLists(int depth) {
            while (!selectLists.isEmpty() && selectLists.peek().depth >= depth) {
                selectLists.pop();
            }
        }

        private int depth() {
            return brackets.size();
        }

        private boolean insideCall() {
            return !brackets.isEmpty() && brackets.peek();
        }

        private boolean followsJoinModifier() {
            return previous != null && previous.is(TokenKind.KEYWORD)
                    && SqlClauses.JOIN_MODIFIERS.contains(previous.upper());
        }

        private boolean isCallee(List<Token> tokens, int index) {
            Token next = SqlClauses.nextSignificant(tokens, index);
            return next != null && next.isPunctuation('(');
        }

        private static boolean isBinaryOperand(Token token) {
            if (token == null) {
                return false;
            }
            return switch (token.kind()) {
                case IDENTIFIER, FUNCTION_NAME, NUMBER_LITERAL, STRING_LITERAL, LITERAL -> true;
                case KEYWORD -> VALUE_KEYWORDS.contains(token.upper());
                case PUNCTUATION -> SqlClauses.isCloseBracket(token);
                case OPERATOR, COMMENT, WHITESPACE -> false;
            };
        }
    }
}
