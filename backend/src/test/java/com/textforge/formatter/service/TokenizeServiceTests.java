package com.textforge.formatter.service;

import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.FormatterConfig;
import com.textforge.formatter.dto.SyntaxToken;
import com.textforge.formatter.dto.TokenizeRequest;
import com.textforge.formatter.dto.TokenizeResponse;
import com.textforge.formatter.sql.SqlDialect;
import com.textforge.formatter.sql.SqlFormatter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TokenizeServiceTests {

	private final SqlFormatter formatter = new SqlFormatter(SqlDialect.standard());
	private final TokenizeService service = new TokenizeService(formatter);

	private static long tableReferences(TokenizeResponse response) {
		return response.tokens().stream().filter(t -> "table-reference".equals(t.semanticInfo())).count();
	}

	@Test
	void testWhitespaceSkippedByDefault() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("SELECT a FROM t"));
		Assertions.assertTrue(response.success());
		Assertions.assertEquals("standard", response.dialect());
		Assertions.assertEquals(4, response.tokens().size());
		Assertions.assertTrue(response.diagnostics().isEmpty());

		TokenizeResponse withWhitespace = service.tokenize(new TokenizeRequest("SELECT a FROM t", true));
		Assertions.assertEquals(7, withWhitespace.tokens().size());
	}

	@Test
	void testTokenPositionsAndTypes() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("SELECT a\nFROM users -- x"));
		SyntaxToken from = response.tokens().get(2);
		Assertions.assertEquals("KEYWORD", from.tokenType());
		Assertions.assertEquals(2, from.startLine());
		Assertions.assertEquals(1, from.startColumn());
		Assertions.assertEquals(5, from.endColumn());

		SyntaxToken table = response.tokens().get(3);
		Assertions.assertEquals("table-reference", table.semanticInfo());

		SyntaxToken comment = response.tokens().get(4);
		Assertions.assertEquals("COMMENT", comment.tokenType());
		Assertions.assertEquals("line-comment", comment.semanticInfo());
	}

	@Test
	void testMultiLineTokenEnd() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("/* a\nbc */"));
		SyntaxToken comment = response.tokens().get(0);
		Assertions.assertEquals(1, comment.startLine());
		Assertions.assertEquals(2, comment.endLine());
		Assertions.assertEquals(6, comment.endColumn());
		Assertions.assertEquals("block-comment", comment.semanticInfo());
	}

	@Test
	void testColumnsCountSupplementaryCharactersOnce() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("select '😀' from t"));
		SyntaxToken literal = response.tokens().get(1);
		Assertions.assertEquals(8, literal.startColumn());
		Assertions.assertEquals(11, literal.endColumn());
		Assertions.assertEquals(12, response.tokens().get(2).startColumn());
	}

	// ------------------------------------------------------------------
	// LEXICAL FINDINGS
	// ------------------------------------------------------------------

	@Test
	void testUnclosedStringReported() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("SELECT 'abc"));
		Assertions.assertEquals(1, response.diagnostics().size());
		Diagnostic finding = response.diagnostics().get(0);
		Assertions.assertEquals("unclosed-string", finding.code());
		Assertions.assertFalse(finding.isError());
		Assertions.assertEquals(1, finding.line());
		Assertions.assertEquals(8, finding.column());
	}

	@Test
	void testUnclosedCommentReported() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("SELECT a\n/* trailing"));
		Assertions.assertEquals(1, response.diagnostics().size());
		Assertions.assertEquals("unclosed-comment", response.diagnostics().get(0).code());
		Assertions.assertEquals(2, response.diagnostics().get(0).line());
	}

	@Test
	void testStructuralProblemsAreNotLexicalFindings() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("SELECT (a FROM t ORDER BY a"));
		Assertions.assertTrue(response.diagnostics().isEmpty());
	}

	// ------------------------------------------------------------------
	// TABLE REFERENCES
	// ------------------------------------------------------------------

	@Test
	void testTableReferencesMatchElementCount() {
		String sql = "SELECT a FROM t JOIN u ON t.id = u.id";
		TokenizeResponse response = service.tokenize(TokenizeRequest.of(sql));
		Assertions.assertEquals(2, tableReferences(response));
		Assertions.assertEquals(formatter.format(sql, FormatterConfig.defaults())
				.stats().elementCount(), tableReferences(response));
	}

	@Test
	void testCreateTableNameIsNotATableReference() {
		TokenizeResponse response = service.tokenize(TokenizeRequest.of("CREATE TABLE foo (id INT)"));
		SyntaxToken name = response.tokens().get(2);
		Assertions.assertEquals("foo", name.value());
		Assertions.assertNull(name.semanticInfo());
		Assertions.assertEquals(0, tableReferences(response));
	}
}
