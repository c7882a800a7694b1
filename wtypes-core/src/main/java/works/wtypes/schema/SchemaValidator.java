package works.wtypes.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.wtypes.exceptions.ValidationFailure;

import static works.wtypes.schema.Keyword.ADDITIONAL_PROPERTIES;
import static works.wtypes.schema.Keyword.CONST;
import static works.wtypes.schema.Keyword.ENUM;
import static works.wtypes.schema.Keyword.EXCLUSIVE_MAXIMUM;
import static works.wtypes.schema.Keyword.EXCLUSIVE_MINIMUM;
import static works.wtypes.schema.Keyword.FORMAT;
import static works.wtypes.schema.Keyword.INSTANCE_OF;
import static works.wtypes.schema.Keyword.MAXIMUM;
import static works.wtypes.schema.Keyword.MAX_ITEMS;
import static works.wtypes.schema.Keyword.MAX_LENGTH;
import static works.wtypes.schema.Keyword.MAX_PROPERTIES;
import static works.wtypes.schema.Keyword.MINIMUM;
import static works.wtypes.schema.Keyword.MIN_ITEMS;
import static works.wtypes.schema.Keyword.MIN_LENGTH;
import static works.wtypes.schema.Keyword.MIN_PROPERTIES;
import static works.wtypes.schema.Keyword.MULTIPLE_OF;
import static works.wtypes.schema.Keyword.PATTERN;
import static works.wtypes.schema.Keyword.UNIQUE_ITEMS;

/**
 * Checks plain Java values against a {@link SchemaNode}.
 * <p>
 * Keywords that apply to one {@link JsonType} constrain only values of that type;
 * it's the {@code type} keyword that rejects values of the wrong type.
 * Every method either returns normally or throws a {@link ValidationFailure}
 * locating the first offending value.
 */
public final class SchemaValidator {
	private SchemaValidator() {}

	public static @Nullable Object validate(SchemaNode node, @Nullable Object value) {
		return validate(node, value, ValuePath.ROOT);
	}

	/**
	 * Full recursive validation.
	 *
	 * @param path the location of {@code value}, used in failure reports
	 * @return {@code value}
	 */
	public static @Nullable Object validate(SchemaNode node, @Nullable Object value, ValuePath path) {
		if (node.isNothing()) {
			throw new ValidationFailure(path, "no value is allowed here", node, value);
		}
		if (node.isAny()) {
			return value;
		}
		node.type().ifPresent(type -> {
			if (!type.matches(value)) {
				throw new ValidationFailure(path, "expected " + type, node, value);
			}
		});
		if (node.has(INSTANCE_OF)) {
			Class<?> expected = (Class<?>) node.get(INSTANCE_OF);
			if (!expected.isInstance(value)) {
				throw new ValidationFailure(path, "expected an instance of " + expected.getName(), node, value);
			}
		}
		if (node.has(CONST) && !Values.jsonEquals(node.get(CONST), value)) {
			throw new ValidationFailure(path, "expected the constant " + node.get(CONST), node, value);
		}
		if (node.has(ENUM) && ((List<?>) node.get(ENUM)).stream().noneMatch(v -> Values.jsonEquals(v, value))) {
			throw new ValidationFailure(path, "expected one of " + node.get(ENUM), node, value);
		}
		JsonType actual = JsonType.of(value);
		if (actual != null) {
			switch (actual) {
				case OBJECT -> checkObject(node, (Map<?, ?>) value, path);
				case ARRAY -> {
					List<?> list = (List<?>) value;
					checkArrayBounds(node, list, path);
					validateItems(node, list, 0, list.size(), path);
				}
				case STRING -> checkString(node, value.toString(), path);
				case INTEGER, NUMBER -> checkNumber(node, (Number) value, path);
				default -> { }
			}
		}
		if (!node.anyOf().isEmpty()) {
			checkAnyOf(node, value, path);
		}
		for (SchemaNode conjunct : node.allOf()) {
			validate(conjunct, value, path);
		}
		if (!node.oneOf().isEmpty()) {
			checkOneOf(node, value, path);
		}
		node.not().ifPresent(negated -> {
			if (accepts(negated, value)) {
				throw new ValidationFailure(path, "matches a schema it must not match", node, value);
			}
		});
		return value;
	}

	/**
	 * @return true if {@code value} conforms to {@code node}
	 */
	public static boolean accepts(SchemaNode node, @Nullable Object value) {
		try {
			validate(node, value);
			return true;
		} catch (ValidationFailure e) {
			return false;
		}
	}

	/**
	 * Checks one member of an object: against its property schema if {@code key} is declared,
	 * or against {@code additionalProperties} otherwise.
	 *
	 * @param objectPath the location of the object containing the member
	 */
	public static void validateEntry(SchemaNode objectNode, String key, @Nullable Object value, ValuePath objectPath) {
		ValuePath path = objectPath.then(key);
		SchemaNode target = objectNode.propertySchema(key);
		if (target.isNothing() && !objectNode.properties().containsKey(key)) {
			throw new ValidationFailure(path, "additional property \"" + key + "\" is not allowed", objectNode, value);
		}
		validate(target, value, path);
	}

	/**
	 * Checks items {@code from} (inclusive) to {@code to} (exclusive) of {@code list}
	 * against the {@code items} keyword of {@code arrayNode}.
	 */
	public static void validateItems(SchemaNode arrayNode, List<?> list, int from, int to, ValuePath arrayPath) {
		Items items = arrayNode.items().orElse(null);
		if (items == null) {
			return;
		}
		for (int i = from; i < to; i++) {
			validate(items.schemaAt(i), list.get(i), arrayPath.then(i));
		}
	}

	private static void checkObject(SchemaNode node, Map<?, ?> map, ValuePath path) {
		for (Object key : map.keySet()) {
			if (!(key instanceof String)) {
				throw new ValidationFailure(path, "object member names must be strings, not " + key, node, map);
			}
		}
		for (String name : node.required()) {
			if (!map.containsKey(name)) {
				throw new ValidationFailure(path, "missing required property \"" + name + "\"", node, map);
			}
		}
		checkCount(node, MIN_PROPERTIES, MAX_PROPERTIES, map.size(), "properties", path, map);
		if (node.has(Keyword.PROPERTIES) || node.has(ADDITIONAL_PROPERTIES)) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				validateEntry(node, (String) entry.getKey(), entry.getValue(), path);
			}
		}
	}

	/**
	 * Array-level keywords only; items are checked separately.
	 */
	public static void checkArrayBounds(SchemaNode node, List<?> list, ValuePath path) {
		checkCount(node, MIN_ITEMS, MAX_ITEMS, list.size(), "items", path, list);
		if (Boolean.TRUE.equals(node.get(UNIQUE_ITEMS))) {
			for (int i = 1; i < list.size(); i++) {
				for (int j = 0; j < i; j++) {
					if (Values.jsonEquals(list.get(i), list.get(j))) {
						throw new ValidationFailure(path.then(i), "duplicates item " + j, node, list.get(i));
					}
				}
			}
		}
	}

	private static void checkCount(SchemaNode node, Keyword minKeyword, Keyword maxKeyword, int count, String noun, ValuePath path, Object actual) {
		Integer min = (Integer) node.get(minKeyword);
		if (min != null && count < min) {
			throw new ValidationFailure(path, "expected at least " + min + " " + noun + ", found " + count, node, actual);
		}
		Integer max = (Integer) node.get(maxKeyword);
		if (max != null && count > max) {
			throw new ValidationFailure(path, "expected at most " + max + " " + noun + ", found " + count, node, actual);
		}
	}

	private static void checkString(SchemaNode node, String s, ValuePath path) {
		if (node.has(MIN_LENGTH) || node.has(MAX_LENGTH)) {
			checkCount(node, MIN_LENGTH, MAX_LENGTH, s.codePointCount(0, s.length()), "characters", path, s);
		}
		String pattern = (String) node.get(PATTERN);
		if (pattern != null && !Formats.compiledPattern(pattern).matcher(s).find()) {
			throw new ValidationFailure(path, "does not match pattern " + pattern, node, s);
		}
		String format = (String) node.get(FORMAT);
		if (format != null && !Formats.conforms(format, s)) {
			throw new ValidationFailure(path, "not a valid " + format, node, s);
		}
	}

	private static void checkNumber(SchemaNode node, Number n, ValuePath path) {
		BigDecimal value = Values.toBigDecimal(n);
		if (value == null) {
			if (node.has(MINIMUM) || node.has(MAXIMUM) || node.has(EXCLUSIVE_MINIMUM) || node.has(EXCLUSIVE_MAXIMUM) || node.has(MULTIPLE_OF)) {
				throw new ValidationFailure(path, "expected a finite number", node, n);
			}
			return;
		}
		BigDecimal minimum = (BigDecimal) node.get(MINIMUM);
		if (minimum != null && value.compareTo(minimum) < 0) {
			throw new ValidationFailure(path, "less than minimum " + minimum.toPlainString(), node, n);
		}
		BigDecimal maximum = (BigDecimal) node.get(MAXIMUM);
		if (maximum != null && value.compareTo(maximum) > 0) {
			throw new ValidationFailure(path, "greater than maximum " + maximum.toPlainString(), node, n);
		}
		BigDecimal exclusiveMinimum = (BigDecimal) node.get(EXCLUSIVE_MINIMUM);
		if (exclusiveMinimum != null && value.compareTo(exclusiveMinimum) <= 0) {
			throw new ValidationFailure(path, "not greater than exclusive minimum " + exclusiveMinimum.toPlainString(), node, n);
		}
		BigDecimal exclusiveMaximum = (BigDecimal) node.get(EXCLUSIVE_MAXIMUM);
		if (exclusiveMaximum != null && value.compareTo(exclusiveMaximum) >= 0) {
			throw new ValidationFailure(path, "not less than exclusive maximum " + exclusiveMaximum.toPlainString(), node, n);
		}
		BigDecimal multipleOf = (BigDecimal) node.get(MULTIPLE_OF);
		if (multipleOf != null && value.remainder(multipleOf).signum() != 0) {
			throw new ValidationFailure(path, "not a multiple of " + multipleOf.toPlainString(), node, n);
		}
	}

	private static void checkAnyOf(SchemaNode node, @Nullable Object value, ValuePath path) {
		List<ValidationFailure> failures = new ArrayList<>();
		for (SchemaNode alternative : node.anyOf()) {
			try {
				validate(alternative, value, path);
				return;
			} catch (ValidationFailure e) {
				failures.add(e);
			}
		}
		throw new ValidationFailure(path, "matches none of " + failures.size() + " alternatives", node, value, failures);
	}

	private static void checkOneOf(SchemaNode node, @Nullable Object value, ValuePath path) {
		List<ValidationFailure> failures = new ArrayList<>();
		int matches = 0;
		for (SchemaNode alternative : node.oneOf()) {
			try {
				validate(alternative, value, path);
				matches++;
			} catch (ValidationFailure e) {
				failures.add(e);
			}
		}
		if (matches == 0) {
			throw new ValidationFailure(path, "matches none of " + failures.size() + " alternatives", node, value, failures);
		} else if (matches > 1) {
			throw new ValidationFailure(path, "matches " + matches + " alternatives but must match exactly one", node, value);
		}
	}
}
