package com.textforge.formatter.service;

import com.textforge.formatter.config.FormatterProperties;
import com.textforge.formatter.core.FormatResult;
import com.textforge.formatter.dto.HtmlFormatRequest;
import com.textforge.formatter.html.HtmlFormatter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HtmlFormatterServiceTests {

	private final HtmlFormatterService service =
			new HtmlFormatterService(FormatterProperties.defaults(), new HtmlFormatter());

	@Test
	void testOptionsAreApplied() {
		HtmlFormatRequest request = new HtmlFormatRequest("<div><p>x</p></div>", "beautify", 4, "spaces",
				null, null, null, null);
		Assertions.assertEquals("<div>\n    <p>\n        x\n    </p>\n</div>", service.format(request).output());
	}

	@Test
	void testTabsIgnoreIndentSize() {
		HtmlFormatRequest request = new HtmlFormatRequest("<div><p>x</p></div>", null, 8, "tab",
				null, null, null, null);
		Assertions.assertEquals("<div>\n\t<p>\n\t\tx\n\t</p>\n</div>", service.format(request).output());
	}

	@Test
	void testInvalidUnit() {
		HtmlFormatRequest request = new HtmlFormatRequest("<p>x</p>", null, null, "dots", null, null, null, null);
		FormatResult result = service.format(request);
		Assertions.assertFalse(result.success());
		Assertions.assertEquals(FormatResult.INVALID_CONFIG, result.errorCode());
	}

	@Test
	void testUnboundLimitBecomesInternalError() {
		HtmlFormatterService unbound = new HtmlFormatterService(
				new FormatterProperties(null, 4, 1, true, "standard"), new HtmlFormatter());
		FormatResult result = Assertions.assertDoesNotThrow(() -> unbound.format(HtmlFormatRequest.of("<p>x</p>")));
		Assertions.assertEquals(FormatResult.INTERNAL_ERROR, result.errorCode());
	}

	@Test
	void testValidateOptOut() {
		HtmlFormatRequest request = new HtmlFormatRequest("<div>", null, null, null, null, null, null, false);
		Assertions.assertTrue(service.format(request).diagnostics().isEmpty());
		Assertions.assertEquals(1, service.format(HtmlFormatRequest.of("<div>")).stats().errorCount());
	}
}
