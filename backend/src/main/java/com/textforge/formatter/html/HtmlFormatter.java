package com.textforge.formatter.html;

import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.FormatResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class HtmlFormatter {

    private static final Logger logger = LoggerFactory.getLogger(HtmlFormatter.class);

    private final HtmlLexer lexer = new HtmlLexer();
    private final HtmlValidator validator = new HtmlValidator();
    private final HtmlBeautifier beautifier = new HtmlBeautifier();
    private final HtmlMinifier minifier = new HtmlMinifier();

    public FormatResult format(String source, HtmlFormatterConfig config) {
        long startTime = System.currentTimeMillis();

        if (source == null || source.isBlank()) {
            return FormatResult.failure(FormatResult.EMPTY_INPUT, "Please provide HTML content to process");
        }

        List<MarkupToken> tokens = lexer.tokenize(source);
        logger.debug("Lexed {} characters into {} markup tokens", source.length(), tokens.size());

        List<Diagnostic> diagnostics = config.validate() ? validator.validate(tokens) : List.of();

        String output = switch (config.mode()) {
            case BEAUTIFY -> beautifier.beautify(tokens, config);
            case MINIFY -> minifier.minify(tokens, config);
        };

        return FormatResult.success(
                source,
                output,
                diagnostics,
                countTopLevelElements(tokens),
                (int) tokens.stream().filter(MarkupToken::isElementStart).count(),
                System.currentTimeMillis() - startTime);
    }

    private int countTopLevelElements(List<MarkupToken> tokens) {
        int depth = 0;
        int topLevel = 0;
        for (MarkupToken token : tokens) {
            if (token.isElementStart() && depth == 0) {
                topLevel++;
            }
            if (token.kind() == MarkupKind.OPEN_TAG) {
                depth++;
            } else if (token.kind() == MarkupKind.CLOSE_TAG) {
                depth = Math.max(0, depth - 1);
            }
        }
        return topLevel;
    }
}
