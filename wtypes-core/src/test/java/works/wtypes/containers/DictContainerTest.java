package works.wtypes.containers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.wtypes.Constraint;
import works.wtypes.ObjectType;
import works.wtypes.RefinedType;
import works.wtypes.Shape;
import works.wtypes.TypeDescriptor;
import works.wtypes.Types;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.ValuePath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wtypes.Types.FLOAT;
import static works.wtypes.Types.INTEGER;
import static works.wtypes.Types.STRING;
import static works.wtypes.schema.Keyword.DEFAULT;

class DictContainerTest {
	static final ObjectType WITH_DEFAULT = Types.dict(Shape.builder()
		.field("i", INTEGER, 20)
		.build());

	static final ObjectType CLOSED = Types.dict(Shape.builder()
		.field("a", INTEGER)
		.field("b", FLOAT, 1.1)
		.additionalProperties(false)
		.build());

	@Test
	void assignments_validateEachField() {
		DictContainer d = new DictContainer(Types.dict(Map.of("a", INTEGER, "b", STRING)), Map.of("a", 1));
		d.put("a", 8);
		d.put("b", "wxyz");
		assertEquals(Map.of("a", 8, "b", "wxyz"), d);

		ValidationFailure e = assertThrows(ValidationFailure.class, () -> d.put("b", 10));
		assertEquals(ValuePath.of("b"), e.path());
		assertEquals("wxyz", d.get("b"));
	}

	@Test
	void construction_fillsDefaults() {
		assertEquals(Map.of("i", 20, "j", 9), new DictContainer(WITH_DEFAULT, Map.of("j", 9)));
		DictContainer supplied = new DictContainer(WITH_DEFAULT, Map.of("i", 9));
		assertEquals(Map.of("i", 9), supplied);
		assertFalse(supplied.containsKey("j"));
	}

	@Test
	void constructionFromEmpty_yieldsExactlyTheDefaults() {
		ObjectType type = Types.dict(Shape.builder()
			.field("x", INTEGER, 1)
			.field("y", Types.list(STRING), List.of("a"))
			.field("z", Types.union(STRING, Types.NULL), null)
			.build());
		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("x", 1);
		expected.put("y", List.of("a"));
		expected.put("z", null);
		assertEquals(expected, new DictContainer(type, Map.of()));
	}

	@Test
	void filledDefaults_areIndependentOfEachOther() {
		ObjectType type = Types.dict(Shape.builder().field("y", Types.DICT, Map.of()).build());
		DictContainer first = new DictContainer(type, Map.of());
		DictContainer second = new DictContainer(type, Map.of());
		first.put("y", Map.of("k", 1));
		assertEquals(Map.of(), second.get("y"));
		assertEquals(Map.of(), type.schema().properties().get("y").get(DEFAULT));
	}

	@Test
	void nestedValues_cannotBeChangedFromOutside() {
		RefinedType type = Types.dict(Map.of("a", Types.list(INTEGER)));
		List<Object> inner = new ArrayList<>(List.of(1));
		DictContainer d = new DictContainer(type, Map.of("a", inner));
		inner.add("x");
		assertEquals(Map.of("a", List.of(1)), d);

		@SuppressWarnings("unchecked")
		List<Object> returned = (List<Object>) d.get("a");
		assertThrows(UnsupportedOperationException.class, () -> returned.add("y"));

		List<Object> assigned = new ArrayList<>(List.of(2, 3));
		d.put("a", assigned);
		assigned.set(0, "z");
		assertEquals(Map.of("a", List.of(2, 3)), d);
		assertTrue(type.accepts(d));
	}

	@Test
	void closedShape_rejectsUnknownFields() {
		assertThrows(ValidationFailure.class, () -> new DictContainer(CLOSED, Map.of("c", 1)));
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		assertEquals(Map.of("a", 1, "b", 1.1), d);
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> d.put("c", 1));
		assertEquals("$.c", e.path().toString());
		assertFalse(d.containsKey("c"));
	}

	@Test
	void missingRequired_failsConstruction() {
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> new DictContainer(CLOSED, Map.of()));
		assertEquals(ValuePath.ROOT, e.path());
	}

	@Test
	void removingRequiredField_fails() {
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		assertThrows(ValidationFailure.class, () -> d.remove("a"));
		assertThrows(ValidationFailure.class, d::clear);
		assertEquals(1, d.get("a"));
		assertEquals(1.1, d.remove("b"));
		assertEquals(Map.of("a", 1), d);
		assertNull(d.remove("absent"));
	}

	@Test
	void putAll_isAtomic() {
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		Map<String, Object> updates = new LinkedHashMap<>();
		updates.put("a", 2);
		updates.put("b", "not a number");
		assertThrows(ValidationFailure.class, () -> d.putAll(updates));
		assertEquals(Map.of("a", 1, "b", 1.1), d);

		d.putAll(Map.of("a", 3, "b", 4.5));
		assertEquals(Map.of("a", 3, "b", 4.5), d);
	}

	@Test
	void replaceAll_isValidated() {
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		assertThrows(ValidationFailure.class, () -> d.replaceAll((k, v) -> "text"));
		assertEquals(1, d.get("a"));
	}

	@Test
	void objectLevelKeywords_checkedOnEveryChange() {
		TypeDescriptor type = Types.refine(Types.DICT, Constraint.maxProperties(1));
		DictContainer d = new DictContainer(type, Map.of("a", 1));
		assertThrows(ValidationFailure.class, () -> d.put("b", 2));
		d.put("a", "replaced");
		assertEquals(Map.of("a", "replaced"), d);
	}

	@Test
	void checkField_doesNotCommit() {
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		d.checkField("a", 5);
		assertThrows(ValidationFailure.class, () -> d.checkField("a", "five"));
		d.checkFields(Map.of("b", 2.0));
		assertEquals(Map.of("a", 1, "b", 1.1), d);
	}

	@Test
	void views_areReadOnly() {
		DictContainer d = new DictContainer(CLOSED, Map.of("a", 1));
		assertThrows(UnsupportedOperationException.class, () -> d.entrySet().clear());
		assertThrows(UnsupportedOperationException.class, () -> d.keySet().remove("b"));
		assertThrows(UnsupportedOperationException.class, () -> d.values().clear());
		assertThrows(UnsupportedOperationException.class, () -> d.entrySet().iterator().next().setValue(2));
	}

	@Test
	void objectDefault_seedsAnEmptyConstruction() {
		TypeDescriptor type = Types.refine(Types.dict(Map.of("a", INTEGER)), Constraint.defaultValue(Map.of("a", 3)));
		assertEquals(Map.of("a", 3), new DictContainer(type));
		assertEquals(Map.of(), new DictContainer(type, Map.of()));
	}

	@Test
	void nonObjectType_isADefinitionError() {
		assertThrows(DefinitionError.class, () -> new DictContainer(Types.LIST));
		assertThrows(DefinitionError.class, () -> new DictContainer(INTEGER, Map.of()));
	}

	@Test
	void nonMappingSeed_failsAtRoot() {
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> DictContainer.from(Types.DICT, List.of(1)));
		assertEquals(ValuePath.ROOT, e.path());
		assertEquals("array", e.actualKind());
	}
}
