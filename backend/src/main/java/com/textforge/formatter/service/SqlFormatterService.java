package com.textforge.formatter.service;

import com.textforge.formatter.config.FormatterProperties;
import com.textforge.formatter.core.FormatMode;
import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.core.FormatterConfig;
import com.textforge.formatter.core.FormatterOptions;
import com.textforge.formatter.core.IndentUnit;
import com.textforge.formatter.core.LetterCase;
import com.textforge.formatter.dto.FormatRequest;
import com.textforge.formatter.exception.InvalidFormatterConfigException;
import com.textforge.formatter.sql.SqlFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SqlFormatterService {

    private static final Logger logger = LoggerFactory.getLogger(SqlFormatterService.class);

    private final FormatterProperties properties;
    private final SqlFormatter formatter;

    public SqlFormatterService(FormatterProperties properties, SqlFormatter formatter) {
        this.properties = properties;
        this.formatter = formatter;
    }

    public FormatResult format(FormatRequest request) {
        String sourceCode = request.sourceCode();

        try {
            if (sourceCode != null && sourceCode.length() > properties.maxSourceLength()) {
                logger.warn("Rejected SQL input of {} characters (limit {})",
                        sourceCode.length(), properties.maxSourceLength());
                return FormatResult.failure(FormatResult.INPUT_TOO_LARGE,
                        "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
            }

            FormatterConfig config = toConfig(request);
            FormatResult result = formatter.format(sourceCode, config);
            if (result.success()) {
                logger.info("Formatted SQL ({}): {} -> {} bytes, {} errors, {} warnings",
                        config.mode(), result.stats().inputSize(), result.stats().outputSize(),
                        result.stats().errorCount(), result.stats().warningCount());
            }
            return result;

        } catch (InvalidFormatterConfigException e) {
            logger.warn("Invalid formatter option '{}': {}", e.getField(), e.getMessage());
            return FormatResult.failure(FormatResult.INVALID_CONFIG, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while formatting SQL: {}", e.getMessage(), e);
            return FormatResult.failure(FormatResult.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    FormatterConfig toConfig(FormatRequest request) throws InvalidFormatterConfigException {
        FormatterConfig defaults = FormatterConfig.defaults();

        return FormatterConfig.builder()
                .mode(FormatterOptions.parseEnum(FormatMode.class, "mode", request.mode(), defaults.mode()))
                .indentSize(FormatterOptions.parseNonNegative("indentSize", request.indentSize(),
                        properties.defaultIndentSize()))
                .indentUnit(FormatterOptions.parseEnum(IndentUnit.class, "indentUnit", request.indentUnit(),
                        defaults.indentUnit()))
                .keywordCase(FormatterOptions.parseEnum(LetterCase.class, "keywordCase", request.keywordCase(),
                        defaults.keywordCase()))
                .functionCase(FormatterOptions.parseEnum(LetterCase.class, "functionCase", request.functionCase(),
                        defaults.functionCase()))
                .identifierCase(FormatterOptions.parseEnum(LetterCase.class, "identifierCase",
                        request.identifierCase(), defaults.identifierCase()))
                .blankLinesBetweenStatements(FormatterOptions.parseNonNegative("blankLinesBetweenStatements",
                        request.blankLinesBetweenStatements(), properties.defaultBlankLines()))
                .validate(request.validate() != null ? request.validate() : properties.validateByDefault())
                .breakAfterJoin(request.breakAfterJoin() != null ? request.breakAfterJoin() : defaults.breakAfterJoin())
                .breakBeforeComma(request.breakBeforeComma() != null
                        ? request.breakBeforeComma() : defaults.breakBeforeComma())
                .build();
    }
}
