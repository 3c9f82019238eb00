package com.textforge.formatter.service;

import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.dto.SyntaxToken;
import com.textforge.formatter.dto.TokenizeRequest;
import com.textforge.formatter.dto.TokenizeResponse;
import com.textforge.formatter.sql.SqlFormatter;
import com.textforge.formatter.sql.Token;
import com.textforge.formatter.sql.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Exposes the SQL lexer output with positions so an editor can highlight it.
 */
@Service
public class TokenizeService {

    private static final Logger logger = LoggerFactory.getLogger(TokenizeService.class);

    private final SqlFormatter formatter;

    public TokenizeService(SqlFormatter formatter) {
        this.formatter = formatter;
    }

    public TokenizeResponse tokenize(TokenizeRequest request) {
        long startTime = System.currentTimeMillis();

        List<Token> tokens = formatter.tokenize(request.sourceCode());
        List<SyntaxToken> highlighted = new ArrayList<>(tokens.size());

        Token previous = null;
        for (Token token : tokens) {
            if (token.is(TokenKind.WHITESPACE) && !request.whitespaceIncluded()) {
                continue;
            }
            highlighted.add(new SyntaxToken(
                    token.line(),
                    token.column(),
                    token.endLine(),
                    token.endColumn(),
                    token.kind().name(),
                    token.text(),
                    semanticInfo(token, previous)));
            if (token.isSignificant()) {
                previous = token;
            }
        }
        List<Diagnostic> findings = formatter.lexicalFindings(tokens);

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Tokenized {} characters into {} tokens ({} lexical findings) in {}ms",
                request.sourceCode().length(), highlighted.size(), findings.size(), analysisTime);

        return TokenizeResponse.of(formatter.dialect().name(), highlighted, findings, analysisTime);
    }

    private String semanticInfo(Token token, Token previous) {
        switch (token.kind()) {
            case IDENTIFIER:
                return previous != null && previous.isTableMarker() ? "table-reference" : null;
            case LITERAL:
                return "bind-parameter";
            case COMMENT:
                return token.isLineComment() ? "line-comment" : "block-comment";
            default:
                return null;
        }
    }
}
