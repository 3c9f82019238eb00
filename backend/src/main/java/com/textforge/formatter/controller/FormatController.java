package com.textforge.formatter.controller;

import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.dto.FormatRequest;
import com.textforge.formatter.dto.FormatResponse;
import com.textforge.formatter.dto.HtmlFormatRequest;
import com.textforge.formatter.dto.TokenizeRequest;
import com.textforge.formatter.dto.TokenizeResponse;
import com.textforge.formatter.service.HtmlFormatterService;
import com.textforge.formatter.service.SqlFormatterService;
import com.textforge.formatter.service.TokenizeService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class FormatController {

    private static final Logger logger = LoggerFactory.getLogger(FormatController.class);

    private final SqlFormatterService sqlFormatterService;
    private final HtmlFormatterService htmlFormatterService;
    private final TokenizeService tokenizeService;

    public FormatController(SqlFormatterService sqlFormatterService, HtmlFormatterService htmlFormatterService,
            TokenizeService tokenizeService) {
        this.sqlFormatterService = sqlFormatterService;
        this.htmlFormatterService = htmlFormatterService;
        this.tokenizeService = tokenizeService;
    }

    @PostMapping("/format/sql")
    public ResponseEntity<FormatResponse> formatSql(@Valid @RequestBody FormatRequest request) {
        logger.info("Received SQL format request (length: {} chars, mode: {})",
                request.sourceCode().length(), request.mode());

        try {
            return respond(sqlFormatterService.format(request));
        } catch (Exception e) {
            logger.error("Unexpected error during SQL formatting: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(FormatResponse.error(FormatResult.INTERNAL_ERROR, "Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/format/html")
    public ResponseEntity<FormatResponse> formatHtml(@Valid @RequestBody HtmlFormatRequest request) {
        logger.info("Received HTML format request (length: {} chars, mode: {})",
                request.sourceCode().length(), request.mode());

        try {
            return respond(htmlFormatterService.format(request));
        } catch (Exception e) {
            logger.error("Unexpected error during HTML formatting: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(FormatResponse.error(FormatResult.INTERNAL_ERROR, "Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/syntax/tokenize")
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody TokenizeRequest request) {
        try {
            TokenizeResponse response = tokenizeService.tokenize(request);
            logger.debug("Tokenized request: {} tokens, {} lexical findings",
                    response.tokens().size(), response.diagnostics().size());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Unexpected error during tokenization: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(TokenizeResponse.internalError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("TextForge formatter backend is healthy");
    }

    private ResponseEntity<FormatResponse> respond(FormatResult result) {
        logger.info("Formatting completed - Success: {}, Diagnostics: {}",
                result.success(), result.diagnostics().size());

        FormatResponse response = FormatResponse.from(result);
        if (FormatResult.INTERNAL_ERROR.equals(result.errorCode())) {
            return ResponseEntity.internalServerError().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<FormatResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest()
                .body(FormatResponse.error(FormatResult.INVALID_CONFIG, errorMessage.toString()));
    }
}
