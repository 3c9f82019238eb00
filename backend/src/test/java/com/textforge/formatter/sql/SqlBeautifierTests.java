package com.textforge.formatter.sql;

import com.textforge.formatter.core.FormatterConfig;
import com.textforge.formatter.core.IndentUnit;
import com.textforge.formatter.core.LetterCase;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SqlBeautifierTests {

	private final SqlLexer lexer = new SqlLexer(SqlDialect.standard());
	private final SqlBeautifier beautifier = new SqlBeautifier();

	private String beautify(String sql) {
		return beautify(sql, FormatterConfig.defaults());
	}

	private String beautify(String sql, FormatterConfig config) {
		return beautifier.beautify(lexer.tokenize(sql), config);
	}

	// ------------------------------------------------------------------
	// LINE BREAKS
	// ------------------------------------------------------------------

	@Test
	void testSelectListAlignsUnderFirstColumn() {
		Assertions.assertEquals("SELECT a,\n       b\nFROM t\nWHERE a = 1",
				beautify("select a,b from t where a=1"));
	}

	@Test
	void testCommaFirstSelectList() {
		FormatterConfig config = FormatterConfig.builder().breakBeforeComma(true).build();
		Assertions.assertEquals("SELECT a\n       , b\nFROM t", beautify("select a, b from t", config));
	}

	@Test
	void testJoinStartsNewLine() {
		Assertions.assertEquals("SELECT *\nFROM a\nINNER JOIN b ON a.id = b.id",
				beautify("select * from a inner join b on a.id=b.id"));
	}

	@Test
	void testJoinStaysInlineWhenDisabled() {
		FormatterConfig config = FormatterConfig.builder().breakAfterJoin(false).build();
		Assertions.assertEquals("SELECT *\nFROM a JOIN b ON a.id = b.id",
				beautify("select * from a join b on a.id=b.id", config));
	}

	@Test
	void testFunctionCallKeepsArgumentsInline() {
		Assertions.assertEquals("SELECT COUNT(*)\nFROM t", beautify("select count(*) from t"));
	}

	@Test
	void testStatementsSeparatedByBlankLines() {
		Assertions.assertEquals("SELECT 1;\n\nSELECT 2;", beautify("select 1; select 2;"));

		FormatterConfig none = FormatterConfig.builder().blankLinesBetweenStatements(0).build();
		Assertions.assertEquals("SELECT 1;\nSELECT 2;", beautify("select 1; select 2;", none));
	}

	@Test
	void testLineCommentKeepsOwnLine() {
		Assertions.assertEquals("-- header\nSELECT a\nFROM t", beautify("-- header\nselect a from t"));
	}

	@Test
	void testSubqueryIsIndented() {
		String expected = "SELECT a\nFROM (\n    SELECT b\n    FROM t) x";
		Assertions.assertEquals(expected, beautify("select a from (select b from t) x"));
	}

	@Test
	void testAdjacentWordsAreSeparated() {
		Assertions.assertEquals("SELECT 1 abc\nFROM t", beautify("select 1abc from t"));
		Assertions.assertEquals("SELECT 'x' 'y'\nFROM t", beautify("select 'x' 'y' from t"));
	}

	@Test
	void testUnterminatedLiteralKeepsTrailingWhitespace() {
		Assertions.assertEquals("SELECT 'un  ", beautify("select 'un  "));
		Assertions.assertEquals("SELECT a\nFROM t /* open  ", beautify("select a from t /* open  "));
	}

	// ------------------------------------------------------------------
	// CASE AND INDENT POLICY
	// ------------------------------------------------------------------

	@Test
	void testCasePolicyPerTokenClass() {
		FormatterConfig config = FormatterConfig.builder()
				.keywordCase(LetterCase.LOWER)
				.functionCase(LetterCase.LOWER)
				.identifierCase(LetterCase.UPPER)
				.build();
		Assertions.assertEquals("select max(PRICE)\nfrom ITEMS", beautify("SELECT MAX(price) FROM items", config));
	}

	@Test
	void testLiteralsAreNeverRecased() {
		Assertions.assertEquals("SELECT 'abc'\nFROM t", beautify("select 'abc' from t"));
	}

	@Test
	void testTabIndent() {
		FormatterConfig config = FormatterConfig.builder().indentUnit(IndentUnit.TABS).build();
		Assertions.assertEquals("SELECT a\nFROM (\n\tSELECT b\n\tFROM t) x",
				beautify("select a from (select b from t) x", config));
	}

	// ------------------------------------------------------------------
	// IDEMPOTENCE
	// ------------------------------------------------------------------

	@Test
	void testBeautifyIsIdempotent() {
		String[] inputs = {
				"select a,b from t where a=1",
				"select a, count(*) as n from orders o left join customers c on o.cid=c.id "
						+ "where o.total > 10 and c.name like 'x%' group by a having count(*) > 1 order by n desc limit 5;"
						+ " select 1",
				"select a from (select b, c from t where c in (1,2,3)) x -- done",
				"insert into t (a, b) values (1, 'two'); update t set a = 2 where b = 'two'"
		};
		for (String input : inputs) {
			String once = beautify(input);
			Assertions.assertEquals(once, beautify(once), input);
		}
	}
}
