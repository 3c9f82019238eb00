package com.textforge.formatter.sql;

import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.core.FormatterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lexes once, optionally validates, then beautifies or minifies. Stateless and safe
 * to share between threads; every call works on its own token list.
 */
public class SqlFormatter {

    private static final Logger logger = LoggerFactory.getLogger(SqlFormatter.class);

    private final SqlLexer lexer;
    private final SqlValidator validator;
    private final SqlBeautifier beautifier;
    private final SqlMinifier minifier;

    public SqlFormatter(SqlDialect dialect) {
        this(new SqlLexer(dialect), new SqlValidator(), new SqlBeautifier(), new SqlMinifier());
    }

    public SqlFormatter(SqlLexer lexer, SqlValidator validator, SqlBeautifier beautifier, SqlMinifier minifier) {
        this.lexer = lexer;
        this.validator = validator;
        this.beautifier = beautifier;
        this.minifier = minifier;
    }

    public List<Token> tokenize(String source) {
        return lexer.tokenize(source);
    }

    /** Unterminated literals and comments only; no clause analysis. */
    public List<Diagnostic> lexicalFindings(List<Token> tokens) {
        return validator.lexicalFindings(tokens);
    }

    public SqlDialect dialect() {
        return lexer.dialect();
    }

    public FormatResult format(String source, FormatterConfig config) {
        long startTime = System.currentTimeMillis();

        if (source == null || source.isBlank()) {
            return FormatResult.failure(FormatResult.EMPTY_INPUT, "Please provide SQL content to process");
        }

        List<Token> tokens = lexer.tokenize(source);
        logger.debug("Lexed {} characters into {} tokens ({} dialect)",
                source.length(), tokens.size(), lexer.dialect().name());

        List<Diagnostic> diagnostics = config.validate() ? validator.validate(tokens) : List.of();
        if (!diagnostics.isEmpty()) {
            logger.debug("Validation produced {} diagnostics", diagnostics.size());
        }

        String output = switch (config.mode()) {
            case BEAUTIFY -> beautifier.beautify(tokens, config);
            case MINIFY -> minifier.minify(tokens, config);
        };

        return FormatResult.success(
                source,
                output,
                diagnostics,
                SqlClauses.countStatements(tokens),
                SqlClauses.countTableReferences(tokens),
                System.currentTimeMillis() - startTime);
    }
}
