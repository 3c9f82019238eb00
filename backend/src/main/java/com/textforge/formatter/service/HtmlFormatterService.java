package com.textforge.formatter.service;

import com.textforge.formatter.config.FormatterProperties;
import com.textforge.formatter.core.FormatMode;
import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.core.FormatterOptions;
import com.textforge.formatter.core.IndentUnit;
import com.textforge.formatter.dto.HtmlFormatRequest;
import com.textforge.formatter.exception.InvalidFormatterConfigException;
import com.textforge.formatter.html.HtmlFormatter;
import com.textforge.formatter.html.HtmlFormatterConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class HtmlFormatterService {

    private static final Logger logger = LoggerFactory.getLogger(HtmlFormatterService.class);

    private final FormatterProperties properties;
    private final HtmlFormatter formatter;

    public HtmlFormatterService(FormatterProperties properties, HtmlFormatter formatter) {
        this.properties = properties;
        this.formatter = formatter;
    }

    public FormatResult format(HtmlFormatRequest request) {
        String sourceCode = request.sourceCode();

        try {
            if (sourceCode != null && sourceCode.length() > properties.maxSourceLength()) {
                logger.warn("Rejected HTML input of {} characters (limit {})",
                        sourceCode.length(), properties.maxSourceLength());
                return FormatResult.failure(FormatResult.INPUT_TOO_LARGE,
                        "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
            }

            HtmlFormatterConfig config = toConfig(request);
            FormatResult result = formatter.format(sourceCode, config);
            if (result.success()) {
                logger.info("Formatted HTML ({}): {} -> {} bytes, {} elements",
                        config.mode(), result.stats().inputSize(), result.stats().outputSize(),
                        result.stats().elementCount());
            }
            return result;

        } catch (InvalidFormatterConfigException e) {
            logger.warn("Invalid formatter option '{}': {}", e.getField(), e.getMessage());
            return FormatResult.failure(FormatResult.INVALID_CONFIG, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while formatting HTML: {}", e.getMessage(), e);
            return FormatResult.failure(FormatResult.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    HtmlFormatterConfig toConfig(HtmlFormatRequest request) throws InvalidFormatterConfigException {
        HtmlFormatterConfig defaults = HtmlFormatterConfig.defaults();

        return new HtmlFormatterConfig(
                FormatterOptions.parseEnum(FormatMode.class, "mode", request.mode(), defaults.mode()),
                FormatterOptions.parseNonNegative("indentSize", request.indentSize(), defaults.indentSize()),
                FormatterOptions.parseEnum(IndentUnit.class, "indentUnit", request.indentUnit(),
                        defaults.indentUnit()),
                request.preserveComments() != null ? request.preserveComments() : defaults.preserveComments(),
                request.sortAttributes() != null ? request.sortAttributes() : defaults.sortAttributes(),
                request.selfCloseTags() != null ? request.selfCloseTags() : defaults.selfCloseTags(),
                request.validate() != null ? request.validate() : properties.validateByDefault());
    }
}
