package com.textforge.formatter.sql;

import com.textforge.formatter.core.Diagnostic;
import com.textforge.formatter.core.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class SqlValidatorTests {

	private final SqlLexer lexer = new SqlLexer(SqlDialect.standard());
	private final SqlValidator validator = new SqlValidator();

	private List<Diagnostic> validate(String sql) {
		return validator.validate(lexer.tokenize(sql));
	}

	private static long count(List<Diagnostic> diagnostics, String code) {
		return diagnostics.stream().filter(d -> d.code().equals(code)).count();
	}

	@Test
	void testCleanQueryHasNoDiagnostics() {
		Assertions.assertTrue(validate("SELECT * FROM users").isEmpty());
	}

	// ------------------------------------------------------------------
	// BRACKETS
	// ------------------------------------------------------------------

	@Test
	void testUnclosedParenIsOnlyError() {
		List<Diagnostic> diagnostics = validate("SELECT (");
		List<Diagnostic> errors = diagnostics.stream().filter(Diagnostic::isError).toList();
		Assertions.assertEquals(1, errors.size());
		Assertions.assertEquals("unclosed-paren", errors.get(0).code());
		Assertions.assertEquals(1, errors.get(0).line());
		Assertions.assertEquals(8, errors.get(0).column());
	}

	@Test
	void testUnexpectedClosingParen() {
		List<Diagnostic> diagnostics = validate("SELECT a) FROM t");
		Assertions.assertEquals(1, count(diagnostics, "unexpected-closing-paren"));
		Assertions.assertEquals(0, count(diagnostics, "unclosed-paren"));
	}

	@Test
	void testUnclosedParensAreReportedLast() {
		List<Diagnostic> diagnostics = validate("SELECT ((a FROM t WHERE b LIKE '%x'");
		Assertions.assertEquals(2, count(diagnostics, "unclosed-paren"));
		Assertions.assertEquals("unclosed-paren", diagnostics.get(diagnostics.size() - 1).code());
		Assertions.assertEquals("unclosed-paren", diagnostics.get(diagnostics.size() - 2).code());
	}

	@Test
	void testMismatchedBracket() {
		List<Diagnostic> diagnostics = validate("SELECT a[1) FROM t");
		Assertions.assertEquals(1, count(diagnostics, "mismatched-bracket"));
	}

	@Test
	void testBracketsInsideStringsAndCommentsAreIgnored() {
		Assertions.assertTrue(validate("SELECT ')(' FROM t -- (").isEmpty());
	}

	// ------------------------------------------------------------------
	// CLAUSES
	// ------------------------------------------------------------------

	@Test
	void testSelectWithoutFromIsWarning() {
		List<Diagnostic> diagnostics = validate("SELECT 1");
		Assertions.assertEquals(1, diagnostics.size());
		Assertions.assertEquals("missing-from-clause", diagnostics.get(0).code());
		Assertions.assertEquals(Severity.WARNING, diagnostics.get(0).severity());
	}

	@Test
	void testSubqueryFromIsScopedByDepth() {
		List<Diagnostic> diagnostics = validate("SELECT (SELECT 1) FROM t");
		Assertions.assertEquals(1, count(diagnostics, "missing-from-clause"));
		Assertions.assertEquals(9, diagnostics.get(0).column());
	}

	@Test
	void testJoinWithoutCondition() {
		Assertions.assertEquals(1, count(validate("SELECT * FROM a JOIN b WHERE a.x = 1"), "join-without-condition"));
		Assertions.assertEquals(0, count(validate("SELECT * FROM a JOIN b ON a.id = b.id"), "join-without-condition"));
		Assertions.assertEquals(0, count(validate("SELECT * FROM a CROSS JOIN b"), "join-without-condition"));
		Assertions.assertEquals(0, count(validate("SELECT * FROM a JOIN b USING (id)"), "join-without-condition"));
	}

	@Test
	void testOrderWithoutLimit() {
		Assertions.assertEquals(1, count(validate("SELECT a FROM t ORDER BY a"), "order-without-limit"));
		Assertions.assertEquals(0, count(validate("SELECT a FROM t ORDER BY a LIMIT 10"), "order-without-limit"));
		Assertions.assertEquals(0, count(validate("SELECT ROW_NUMBER() OVER (ORDER BY a) FROM t"),
				"order-without-limit"));
	}

	@Test
	void testLimitInsideSubqueryDoesNotCoverOuterOrder() {
		Assertions.assertEquals(1, count(validate("SELECT a FROM (SELECT b FROM t LIMIT 1) x ORDER BY a"),
				"order-without-limit"));
	}

	@Test
	void testLeadingWildcard() {
		Assertions.assertEquals(1, count(validate("SELECT a FROM t WHERE a LIKE '%x'"), "leading-wildcard"));
		Assertions.assertEquals(0, count(validate("SELECT a FROM t WHERE a LIKE 'x%'"), "leading-wildcard"));
	}

	// ------------------------------------------------------------------
	// LEXICAL
	// ------------------------------------------------------------------

	@Test
	void testUnclosedStringAndComment() {
		Assertions.assertEquals(1, count(validate("SELECT a FROM t WHERE b = 'x"), "unclosed-string"));
		Assertions.assertEquals(1, count(validate("SELECT a FROM t /* note"), "unclosed-comment"));
	}

	@Test
	void testInjectionPatterns() {
		List<Diagnostic> tautology = validate("SELECT * FROM users WHERE name = '' OR '1'='1'");
		Assertions.assertEquals(1, count(tautology, "sql-injection"));
		Assertions.assertTrue(tautology.stream().filter(d -> d.code().equals("sql-injection")).allMatch(Diagnostic::isError));

		Assertions.assertEquals(1, count(validate("SELECT * FROM users WHERE id = 1 OR 1=1"), "sql-injection"));
		Assertions.assertEquals(1, count(validate("SELECT * FROM t WHERE a = 'x'; DROP TABLE users"), "sql-injection"));
		Assertions.assertEquals(0, count(validate("SELECT * FROM t WHERE a = 1 OR b = 2"), "sql-injection"));
	}

	@Test
	void testDiagnosticsFollowSourceOrder() {
		List<Diagnostic> diagnostics = validate("SELECT 1;\nSELECT a FROM t ORDER BY a");
		Assertions.assertEquals("missing-from-clause", diagnostics.get(0).code());
		Assertions.assertEquals("order-without-limit", diagnostics.get(1).code());
		Assertions.assertEquals(2, diagnostics.get(1).line());
	}
}
