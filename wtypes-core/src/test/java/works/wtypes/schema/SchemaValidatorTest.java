package works.wtypes.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.wtypes.exceptions.ValidationFailure;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wtypes.schema.Keyword.ADDITIONAL_PROPERTIES;
import static works.wtypes.schema.Keyword.ALL_OF;
import static works.wtypes.schema.Keyword.ANY_OF;
import static works.wtypes.schema.Keyword.CONST;
import static works.wtypes.schema.Keyword.ENUM;
import static works.wtypes.schema.Keyword.EXCLUSIVE_MAXIMUM;
import static works.wtypes.schema.Keyword.ITEMS;
import static works.wtypes.schema.Keyword.MAX_PROPERTIES;
import static works.wtypes.schema.Keyword.MINIMUM;
import static works.wtypes.schema.Keyword.MIN_LENGTH;
import static works.wtypes.schema.Keyword.MULTIPLE_OF;
import static works.wtypes.schema.Keyword.NOT;
import static works.wtypes.schema.Keyword.ONE_OF;
import static works.wtypes.schema.Keyword.PATTERN;
import static works.wtypes.schema.Keyword.PROPERTIES;
import static works.wtypes.schema.Keyword.REQUIRED;
import static works.wtypes.schema.Keyword.TYPE;
import static works.wtypes.schema.Keyword.UNIQUE_ITEMS;

class SchemaValidatorTest {
	static final SchemaNode INTEGER = SchemaNode.ofType(JsonType.INTEGER);
	static final SchemaNode NUMBER = SchemaNode.ofType(JsonType.NUMBER);
	static final SchemaNode STRING = SchemaNode.ofType(JsonType.STRING);

	@Test
	void validate_returnsValue() {
		Object value = "hello";
		assertSame(value, SchemaValidator.validate(STRING, value));
	}

	@Test
	void integer_acceptsIntegralNumbersOfAnyClass() {
		for (Object value : List.of(3, 3L, (short) 3, 3.0, new BigDecimal("3.00"), BigInteger.TEN)) {
			assertTrue(SchemaValidator.accepts(INTEGER, value), () -> "Should accept " + value);
		}
		assertFalse(SchemaValidator.accepts(INTEGER, 3.5));
		assertFalse(SchemaValidator.accepts(INTEGER, "3"));
	}

	@Test
	void number_acceptsIntegersButNotBooleans() {
		assertTrue(SchemaValidator.accepts(NUMBER, 3));
		assertTrue(SchemaValidator.accepts(NUMBER, 3.5f));
		assertFalse(SchemaValidator.accepts(NUMBER, true));
	}

	@Test
	void typeMismatch_reportsRootPath() {
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(INTEGER, "x"));
		assertEquals(ValuePath.ROOT, e.path());
		assertEquals("string", e.actualKind());
		assertEquals("x", e.actual());
		assertSame(INTEGER, e.expected());
		assertThat(e.getMessage(), containsString("$: expected integer"));
	}

	@Test
	void nestedFailure_reportsFullPath() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.OBJECT)
			.put(PROPERTIES, Map.of("items", SchemaNode.builder()
				.put(TYPE, JsonType.ARRAY)
				.put(ITEMS, INTEGER)
				.build()))
			.build();
		ValidationFailure e = assertThrows(ValidationFailure.class,
			() -> SchemaValidator.validate(node, Map.of("items", List.of(1, 2, "three"))));
		assertEquals("$.items[2]", e.path().toString());
		assertEquals("three", e.actual());
	}

	@Test
	void missingRequired_namesTheProperty() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.OBJECT)
			.put(REQUIRED, List.of("a", "b"))
			.build();
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(node, Map.of("a", 1)));
		assertThat(e.reason(), containsString("\"b\""));
	}

	@Test
	void additionalPropertyFalse_rejectsUnknownKeys() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.OBJECT)
			.put(PROPERTIES, Map.of("a", INTEGER))
			.put(ADDITIONAL_PROPERTIES, false)
			.build();
		assertTrue(SchemaValidator.accepts(node, Map.of("a", 1)));
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(node, Map.of("c", 1)));
		assertEquals("$.c", e.path().toString());
	}

	@Test
	void additionalPropertiesSchema_appliesToUndeclaredKeys() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.OBJECT)
			.put(ADDITIONAL_PROPERTIES, STRING)
			.build();
		assertTrue(SchemaValidator.accepts(node, Map.of("x", "y")));
		assertFalse(SchemaValidator.accepts(node, Map.of("x", 1)));
	}

	@Test
	void nonStringKeys_rejected() {
		assertFalse(SchemaValidator.accepts(SchemaNode.ofType(JsonType.OBJECT), Map.of(1, "one")));
	}

	@Test
	void maxProperties() {
		SchemaNode node = SchemaNode.of(MAX_PROPERTIES, 1);
		assertTrue(SchemaValidator.accepts(node, Map.of("a", 1)));
		assertFalse(SchemaValidator.accepts(node, Map.of("a", 1, "b", 2)));
	}

	@Test
	void typedKeywords_ignoreOtherTypes() {
		SchemaNode node = SchemaNode.of(MIN_LENGTH, 3);
		assertTrue(SchemaValidator.accepts(node, 1));
		assertTrue(SchemaValidator.accepts(node, "abc"));
		assertFalse(SchemaValidator.accepts(node, "ab"));
	}

	@Test
	void pattern_isUnanchored() {
		SchemaNode node = SchemaNode.builder().put(TYPE, JsonType.STRING).put(PATTERN, "b+").build();
		assertTrue(SchemaValidator.accepts(node, "abbc"));
		assertFalse(SchemaValidator.accepts(node, "ac"));
	}

	@Test
	void stringLength_countsCodePoints() {
		SchemaNode node = SchemaNode.of(MIN_LENGTH, 2);
		assertFalse(SchemaValidator.accepts(node, "🌳"));
		assertTrue(SchemaValidator.accepts(node, "🌳🌳"));
	}

	@Test
	void numericBounds() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.NUMBER)
			.put(MINIMUM, 0)
			.put(EXCLUSIVE_MAXIMUM, 10)
			.put(MULTIPLE_OF, 0.5)
			.build();
		assertTrue(SchemaValidator.accepts(node, 0));
		assertTrue(SchemaValidator.accepts(node, 9.5));
		assertFalse(SchemaValidator.accepts(node, -0.5));
		assertFalse(SchemaValidator.accepts(node, 10));
		assertFalse(SchemaValidator.accepts(node, 1.2));
	}

	@Test
	void uniqueItems_usesJsonEquality() {
		SchemaNode node = SchemaNode.builder().put(TYPE, JsonType.ARRAY).put(UNIQUE_ITEMS, true).build();
		assertTrue(SchemaValidator.accepts(node, List.of(1, 2)));
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(node, List.of(1, 1.0)));
		assertEquals("$[1]", e.path().toString());
	}

	@Test
	void constAndEnum() {
		assertTrue(SchemaValidator.accepts(SchemaNode.of(CONST, 1), 1L));
		assertFalse(SchemaValidator.accepts(SchemaNode.of(CONST, 1), 2));
		SchemaNode oneOf = SchemaNode.of(ENUM, List.of(1, "a"));
		assertTrue(SchemaValidator.accepts(oneOf, "a"));
		assertFalse(SchemaValidator.accepts(oneOf, "b"));
	}

	@Test
	void anyOf_collectsEveryAlternativesFailure() {
		SchemaNode node = SchemaNode.of(ANY_OF, List.of(INTEGER, STRING));
		assertTrue(SchemaValidator.accepts(node, 1));
		assertTrue(SchemaValidator.accepts(node, "one"));
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(node, true));
		assertEquals(2, e.causes().size());
		assertEquals(2, e.getSuppressed().length);
		assertSame(node, e.expected());
	}

	@Test
	void nothing_rejectsEverything() {
		assertFalse(SchemaValidator.accepts(SchemaNode.NOTHING, null));
		assertTrue(SchemaValidator.accepts(SchemaNode.ANY, new Object()));
	}

	@Test
	void validateEntry_checksOneMember() {
		SchemaNode node = SchemaNode.builder()
			.put(TYPE, JsonType.OBJECT)
			.put(PROPERTIES, Map.of("a", INTEGER))
			.put(REQUIRED, List.of("a"))
			.build();
		SchemaValidator.validateEntry(node, "a", 5, ValuePath.ROOT);
		ValidationFailure e = assertThrows(ValidationFailure.class,
			() -> SchemaValidator.validateEntry(node, "a", "five", ValuePath.of("config")));
		assertEquals("$.config.a", e.path().toString());
	}

	@Test
	void allOf_reportsTheFirstFailingConjunct() {
		SchemaNode node = SchemaNode.of(ALL_OF, List.of(NUMBER, SchemaNode.of(MINIMUM, 5)));
		assertTrue(SchemaValidator.accepts(node, 7));
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> SchemaValidator.validate(node, 3, ValuePath.of("n")));
		assertEquals("$.n", e.path().toString());
		assertThat(e.reason(), containsString("minimum"));
	}

	@Test
	void oneOf_countsMatches() {
		SchemaNode node = SchemaNode.of(ONE_OF, List.of(INTEGER, NUMBER));
		assertTrue(SchemaValidator.accepts(node, 2.5));
		assertFalse(SchemaValidator.accepts(node, 2));
		assertFalse(SchemaValidator.accepts(node, "2"));
	}

	@Test
	void not_inverts() {
		SchemaNode node = SchemaNode.of(NOT, INTEGER);
		assertTrue(SchemaValidator.accepts(node, "1"));
		assertFalse(SchemaValidator.accepts(node, 1));
		assertFalse(SchemaValidator.accepts(SchemaNode.of(NOT, true), null));
	}
}
