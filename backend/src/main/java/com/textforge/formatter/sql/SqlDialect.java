package com.textforge.formatter.sql;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lookup tables and lexical markers of one SQL dialect. Immutable; handed to
 * {@link SqlLexer} at construction so dialects can be swapped per call.
 */
public final class SqlDialect {

    private static final Set<String> STANDARD_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL",
            "ON", "USING", "GROUP", "BY", "HAVING", "ORDER", "ASC", "DESC", "LIMIT", "OFFSET", "FETCH",
            "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE", "CREATE", "TABLE",
            "ALTER", "DROP", "INDEX", "VIEW", "DATABASE", "SCHEMA", "CONSTRAINT",
            "PRIMARY", "KEY", "FOREIGN", "REFERENCES", "UNIQUE", "NOT", "NULL",
            "DEFAULT", "AUTO_INCREMENT", "TIMESTAMP", "DATETIME", "DATE", "TIME",
            "VARCHAR", "CHAR", "TEXT", "INT", "INTEGER", "BIGINT", "SMALLINT", "TINYINT",
            "DECIMAL", "NUMERIC", "FLOAT", "DOUBLE", "BOOLEAN", "BOOL", "BIT",
            "UNION", "INTERSECT", "EXCEPT", "ALL", "DISTINCT", "AS", "CASE", "WHEN", "THEN", "ELSE", "END",
            "IF", "EXISTS", "IN", "BETWEEN", "LIKE", "ILIKE", "REGEXP", "RLIKE",
            "IS", "AND", "OR", "XOR", "DIV", "MOD", "MATCH", "AGAINST", "FULLTEXT",
            "WITH", "RECURSIVE", "WINDOW", "OVER", "PARTITION", "ROWS", "RANGE",
            "UNBOUNDED", "PRECEDING", "FOLLOWING", "CURRENT", "ROW", "FIRST", "LAST",
            "TRUE", "FALSE");

    private static final Set<String> STANDARD_FUNCTIONS = Set.of(
            "COUNT", "SUM", "AVG", "MIN", "MAX", "ABS", "ROUND", "CEIL", "CEILING",
            "FLOOR", "POWER", "SQRT", "RAND", "RANDOM", "UPPER", "LOWER", "LENGTH",
            "LEN", "SUBSTRING", "SUBSTR", "TRIM", "LTRIM", "RTRIM", "CONCAT",
            "COALESCE", "NULLIF", "ISNULL", "IFNULL", "NOW", "CURDATE", "CURTIME",
            "DATE_ADD", "DATE_SUB", "DATEDIFF", "YEAR", "MONTH", "DAY", "HOUR",
            "MINUTE", "SECOND", "CAST", "CONVERT", "FORMAT", "REPLACE", "STUFF",
            "ROW_NUMBER", "RANK", "DENSE_RANK", "LAG", "LEAD");

    private static final Set<String> STANDARD_OPERATORS = Set.of(
            "=", "<>", "!=", "<", ">", "<=", ">=", "+", "-", "/", "%", "||",
            "&&", "!", "^", "&", "|", "<<", ">>", "~", "<->");

    private final String name;
    private final Set<String> keywords;
    private final Set<String> functions;
    private final List<String> operatorsLongestFirst;
    private final String quoteCharacters;
    private final String identifierExtras;
    private final String lineCommentMarker;
    private final String blockCommentOpen;
    private final String blockCommentClose;

    private SqlDialect(String name, Set<String> keywords, Set<String> functions, Set<String> operators,
            String quoteCharacters, String identifierExtras) {
        this.name = name;
        this.keywords = Set.copyOf(keywords);
        this.functions = Set.copyOf(functions);
        this.operatorsLongestFirst = operators.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
        this.quoteCharacters = quoteCharacters;
        this.identifierExtras = identifierExtras;
        this.lineCommentMarker = "--";
        this.blockCommentOpen = "/*";
        this.blockCommentClose = "*/";
    }

    public static SqlDialect standard() {
        return new SqlDialect("standard", STANDARD_KEYWORDS, STANDARD_FUNCTIONS, STANDARD_OPERATORS,
                "'\"`", "@#$");
    }

    public static SqlDialect mysql() {
        return new SqlDialect("mysql",
                union(STANDARD_KEYWORDS, Set.of("IGNORE", "DUPLICATE", "ENGINE", "CHARSET", "UNSIGNED",
                        "SHOW", "DESCRIBE", "STRAIGHT_JOIN", "SOUNDS")),
                union(STANDARD_FUNCTIONS, Set.of("GROUP_CONCAT", "IF", "UNIX_TIMESTAMP", "FROM_UNIXTIME",
                        "DATE_FORMAT", "STR_TO_DATE", "LAST_INSERT_ID")),
                union(STANDARD_OPERATORS, Set.of("<=>", ":=")),
                "'\"`", "@#$");
    }

    public static SqlDialect postgresql() {
        return new SqlDialect("postgresql",
                union(STANDARD_KEYWORDS, Set.of("RETURNING", "SERIAL", "BIGSERIAL", "JSONB", "ILIKE", "LATERAL",
                        "CONFLICT", "DO", "NOTHING", "MATERIALIZED")),
                union(STANDARD_FUNCTIONS, Set.of("STRING_AGG", "ARRAY_AGG", "JSONB_BUILD_OBJECT", "TO_CHAR",
                        "DATE_TRUNC", "GENERATE_SERIES", "EXTRACT")),
                union(STANDARD_OPERATORS, Set.of("::", "->", "->>", "#>", "#>>", "@>", "<@", "~*", "!~", "!~*")),
                "'\"", "_$");
    }

    public static SqlDialect forName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "standard", "ansi" -> standard();
            case "mysql", "mariadb" -> mysql();
            case "postgresql", "postgres" -> postgresql();
            default -> throw new IllegalArgumentException("Unknown SQL dialect: " + name);
        };
    }

    private static Set<String> union(Set<String> base, Set<String> extra) {
        Set<String> merged = new HashSet<>(base);
        merged.addAll(extra);
        return merged;
    }

    public TokenKind classifyWord(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        if (keywords.contains(upper)) {
            return TokenKind.KEYWORD;
        }
        if (functions.contains(upper)) {
            return TokenKind.FUNCTION_NAME;
        }
        return TokenKind.IDENTIFIER;
    }

    public String matchOperator(String source, int position) {
        for (String operator : operatorsLongestFirst) {
            if (source.startsWith(operator, position)) {
                return operator;
            }
        }
        return null;
    }

    public boolean isQuote(int codePoint) {
        return quoteCharacters.indexOf(codePoint) >= 0;
    }

    public boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isLetter(codePoint) || identifierExtras.indexOf(codePoint) >= 0;
    }

    public boolean isIdentifierPart(int codePoint) {
        return isIdentifierStart(codePoint) || Character.isDigit(codePoint);
    }

    public String name() {
        return name;
    }

    public Set<String> keywords() {
        return keywords;
    }

    public Set<String> functions() {
        return functions;
    }

    public String lineCommentMarker() {
        return lineCommentMarker;
    }

    public String blockCommentOpen() {
        return blockCommentOpen;
    }

    public String blockCommentClose() {
        return blockCommentClose;
    }
}
