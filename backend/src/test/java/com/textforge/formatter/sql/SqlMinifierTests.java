package com.textforge.formatter.sql;

import com.textforge.formatter.core.FormatterConfig;
import com.textforge.formatter.core.LetterCase;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class SqlMinifierTests {

	private final SqlLexer lexer = new SqlLexer(SqlDialect.standard());
	private final SqlMinifier minifier = new SqlMinifier();

	private String minify(String sql) {
		return minifier.minify(lexer.tokenize(sql), FormatterConfig.defaults());
	}

	@Test
	void testWhitespaceAndCommentsDropped() {
		Assertions.assertEquals("SELECT a,b FROM t WHERE x='y'",
				minify("SELECT  a ,  b\nFROM t -- c\nWHERE x = 'y' /* end */"));
	}

	@Test
	void testOutputIsNeverLonger() {
		String[] inputs = {
				"select   a from t",
				"SELECT a FROM t WHERE b <= 1 AND c <> 'x'",
				"  select count( * )  from   t ;  "
		};
		for (String input : inputs) {
			Assertions.assertTrue(minify(input).length() <= input.length(), input);
		}
	}

	@Test
	void testNeverLongerThanBeautified() {
		SqlBeautifier beautifier = new SqlBeautifier();
		String[] inputs = {
				"select 1abc from t",
				"select 1e3left from t",
				"select \"q\"1from t",
				"select 'un  ",
				"select a,b from t where a=1 order by b",
				"SELECT a FROM t WHERE x = -1 AND y<>'z' -- note",
				"select count(*) from (select b from u) x;select 2"
		};
		for (String input : inputs) {
			List<Token> tokens = lexer.tokenize(input);
			String beautified = beautifier.beautify(tokens, FormatterConfig.defaults());
			String minified = minifier.minify(tokens, FormatterConfig.defaults());
			Assertions.assertTrue(minified.length() <= beautified.length(),
					() -> input + " -> [" + minified + "] vs [" + beautified + "]");
		}
	}

	@Test
	void testAdjacentOperatorsStaySeparated() {
		Assertions.assertEquals("a< =b", minify("a < = b"));
	}

	@Test
	void testMinifiedOutputLexesToSameSignificantTokens() {
		String input = "SELECT a , b FROM t WHERE a - -1 > 0 AND s = 'x' 'y'";
		List<String> before = lexer.tokenize(input).stream().filter(Token::isSignificant).map(Token::text).toList();
		List<String> after = lexer.tokenize(minify(input)).stream().filter(Token::isSignificant).map(Token::text).toList();
		Assertions.assertEquals(before, after);
	}

	@Test
	void testCasePolicyApplies() {
		FormatterConfig config = FormatterConfig.builder().keywordCase(LetterCase.LOWER).build();
		Assertions.assertEquals("select a from t", minifier.minify(lexer.tokenize("SELECT a FROM t"), config));
	}
}
