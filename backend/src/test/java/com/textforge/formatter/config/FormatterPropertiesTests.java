package com.textforge.formatter.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

class FormatterPropertiesTests {

	private static ValidatorFactory factory;
	private static Validator validator;

	@BeforeAll
	static void setUp() {
		factory = Validation.buildDefaultValidatorFactory();
		validator = factory.getValidator();
	}

	@AfterAll
	static void tearDown() {
		factory.close();
	}

	private static Set<String> invalidFields(FormatterProperties properties) {
		Set<ConstraintViolation<FormatterProperties>> violations = validator.validate(properties);
		return violations.stream()
				.map(v -> v.getPropertyPath().toString())
				.collect(Collectors.toSet());
	}

	@Test
	void testDefaultsAreValid() {
		Assertions.assertTrue(invalidFields(FormatterProperties.defaults()).isEmpty());
	}

	@Test
	void testMissingNumbersAreRejected() {
		Assertions.assertEquals(Set.of("maxSourceLength"),
				invalidFields(new FormatterProperties(null, 4, 1, true, "standard")));
		Assertions.assertEquals(Set.of("defaultIndentSize", "defaultBlankLines"),
				invalidFields(new FormatterProperties(100, null, null, true, "standard")));
	}

	@Test
	void testRangesAreChecked() {
		Assertions.assertEquals(Set.of("maxSourceLength", "defaultIndentSize"),
				invalidFields(new FormatterProperties(0, -1, 0, true, "standard")));
		Assertions.assertEquals(Set.of("sqlDialect"),
				invalidFields(new FormatterProperties(100, 4, 1, true, " ")));
	}
}
