package works.wtypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wtypes.Types.BOOLEAN;
import static works.wtypes.Types.FLOAT;
import static works.wtypes.Types.INTEGER;
import static works.wtypes.Types.NULL;
import static works.wtypes.Types.STRING;

class CombinatorTest {
	static final List<Object> SAMPLE_VALUES = Arrays.asList(
		null, true, 0, -3, 2.5, "", "abc", List.of(), List.of(1, 2), Map.of(), Map.of("a", 1));

	static final List<TypeDescriptor> OPERANDS = List.of(
		INTEGER,
		FLOAT,
		STRING,
		BOOLEAN,
		NULL,
		Types.list(INTEGER),
		Types.dict(Map.of("a", INTEGER)),
		Types.refine(STRING, Constraint.minLength(2)));

	static Stream<Arguments> operandPairs() {
		List<Arguments> result = new ArrayList<>();
		for (TypeDescriptor a : OPERANDS) {
			for (TypeDescriptor b : OPERANDS) {
				result.add(Arguments.of(a, b));
			}
		}
		return result.stream();
	}

	@ParameterizedTest
	@MethodSource("operandPairs")
	void union_isCommutative(TypeDescriptor a, TypeDescriptor b) {
		UnionType ab = Types.union(a, b);
		UnionType ba = Types.union(b, a);
		for (Object value : SAMPLE_VALUES) {
			assertEquals(ab.accepts(value), ba.accepts(value), () -> "Disagreement on " + value);
			assertEquals(a.accepts(value) || b.accepts(value), ab.accepts(value), () -> "Wrong result for " + value);
		}
	}

	@ParameterizedTest
	@MethodSource("operandPairs")
	void union_isAssociative(TypeDescriptor a, TypeDescriptor b) {
		UnionType left = Types.union(Types.union(a, b), STRING);
		UnionType right = Types.union(a, Types.union(b, STRING));
		for (Object value : SAMPLE_VALUES) {
			assertEquals(left.accepts(value), right.accepts(value), () -> "Disagreement on " + value);
		}
	}

	@ParameterizedTest
	@MethodSource("operandPairs")
	void refine_onlyNarrows(TypeDescriptor base, TypeDescriptor ignored) {
		RefinedType refined = Types.refine(base, Constraint.oneOfValues(0, "abc", List.of(1, 2)));
		for (Object value : SAMPLE_VALUES) {
			if (refined.accepts(value)) {
				assertTrue(base.accepts(value), () -> "Refinement accepted " + value);
			}
		}
	}

	@Test
	void union_reportsEveryOperandFailure() {
		UnionType type = Types.union(INTEGER, Types.refine(STRING, Constraint.maxLength(3)));
		assertTrue(type.accepts("abc"));
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> type.validate("abcd"));
		assertEquals(2, e.causes().size());
		assertThat(e.causes().get(0).reason(), containsString("integer"));
		assertThat(e.causes().get(1).reason(), containsString("at most 3"));
	}

	@Test
	void union_ofNothing_throws() {
		assertThrows(DefinitionError.class, () -> Types.union());
	}

	@Test
	void refine_addsRequiredFields() {
		RefinedType type = Types.refine(Types.dict(Map.of("a", INTEGER, "b", STRING)), Constraint.required("a"));
		assertTrue(type.accepts(Map.of("a", 1)));
		assertFalse(type.accepts(Map.of("b", "x")));
	}

	@Test
	void refine_ofRefinement_overridesScalarKeywords() {
		RefinedType atLeastThree = Types.refine(INTEGER, Constraint.minimum(3));
		RefinedType atLeastFive = Types.refine(atLeastThree, Constraint.minimum(5));
		assertTrue(atLeastThree.accepts(4));
		assertFalse(atLeastFive.accepts(4));
		assertEquals(Map.of("type", "integer", "minimum", 5), atLeastFive.toSchema());
	}

	@Test
	void refine_withInapplicableKeyword_throws() {
		DefinitionError e = assertThrows(DefinitionError.class, () -> Types.refine(INTEGER, Constraint.minLength(3)));
		assertThat(e.getMessage(), containsString("minLength"));
	}

	@Test
	void refine_withNonconformingDefault_throws() {
		assertThrows(DefinitionError.class, () -> Types.refine(INTEGER, Constraint.defaultValue("x")));
		assertEquals(Map.of("type", "integer", "default", 3), Types.refine(INTEGER, Constraint.defaultValue(3)).toSchema());
	}

	@Test
	void refine_checksTheCombinedKeywords() {
		// Each bound is fine on its own
		assertThrows(DefinitionError.class, () -> Types.refine(Types.LIST, Constraint.minItems(3), Constraint.maxItems(2)));
	}

	@Test
	void malformedConstraints_throw() {
		assertThrows(DefinitionError.class, () -> Constraint.minItems(-1));
		assertThrows(DefinitionError.class, () -> Constraint.pattern("("));
		assertThrows(DefinitionError.class, () -> Constraint.multipleOf(0));
		assertThrows(DefinitionError.class, () -> Constraint.required(" "));
		assertThrows(DefinitionError.class, () -> Constraint.oneOfValues());
	}

	@Test
	void constraintAlone_checksOnlyItsKeyword() {
		Constraint minimum = Constraint.minimum(3);
		assertTrue(minimum.accepts(5));
		assertTrue(minimum.accepts("not a number"));
		assertFalse(minimum.accepts(2));
	}

	@Test
	void additionalPropertiesConstraint() {
		RefinedType closed = Types.refine(Types.dict(Map.of("a", INTEGER)), Constraint.additionalProperties(false));
		assertEquals(Boolean.FALSE, closed.toSchema().get("additionalProperties"));
		assertTrue(closed.accepts(Map.of("a", 1)));
		assertFalse(closed.accepts(Map.of("b", 1)));

		RefinedType strings = Types.refine(Types.DICT, Constraint.additionalProperties(STRING));
		assertTrue(strings.accepts(Map.of("b", "x")));
		assertFalse(strings.accepts(Map.of("b", 1)));
	}

	@Test
	void annotations_renderButDontConstrain() {
		RefinedType type = Types.refine(STRING, Constraint.title("Name"), Constraint.description("Who"), Constraint.format("color"));
		assertEquals(Map.of("type", "string", "title", "Name", "description", "Who", "format", "color"), type.toSchema());
		assertTrue(type.accepts("anything"));
	}

	@Test
	void constant() {
		RefinedType type = Types.refine(FLOAT, Constraint.constant(1));
		assertTrue(type.accepts(1.0));
		assertFalse(type.accepts(2));
	}

	static final RefinedType POSITIVE = Types.refine(FLOAT, Constraint.exclusiveMinimum(0));
	static final RefinedType MULTIPLE_OF_THREE = Types.refine(INTEGER, Constraint.multipleOf(3));

	@Test
	void allOf_requiresEveryOperand() {
		IntersectionType type = Types.allOf(POSITIVE, MULTIPLE_OF_THREE);
		assertTrue(type.accepts(9));
		assertFalse(type.accepts(-9));
		assertFalse(type.accepts(4));
		assertEquals(List.of(POSITIVE.toSchema(), MULTIPLE_OF_THREE.toSchema()), type.toSchema().get("allOf"));
	}

	@Test
	void oneOf_requiresExactlyOneOperand() {
		ExclusiveUnionType type = Types.oneOf(POSITIVE, MULTIPLE_OF_THREE);
		assertTrue(type.accepts(-9));
		assertTrue(type.accepts(4));
		ValidationFailure both = assertThrows(ValidationFailure.class, () -> type.validate(9));
		assertThat(both.reason(), containsString("exactly one"));
		ValidationFailure neither = assertThrows(ValidationFailure.class, () -> type.validate("nine"));
		assertEquals(2, neither.causes().size());
	}

	@Test
	void not_acceptsWhatItsOperandRejects() {
		ComplementType type = Types.not(STRING);
		assertTrue(type.accepts(100));
		assertFalse(type.accepts("abc"));
		assertEquals(Map.of("not", Map.of("type", "string")), type.toSchema());
		assertTrue(Types.not(type).accepts("abc"));
	}

	@Test
	void compositions_ofNothing_throw() {
		assertThrows(DefinitionError.class, () -> Types.allOf());
		assertThrows(DefinitionError.class, () -> Types.oneOf());
	}
}
