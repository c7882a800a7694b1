package works.wtypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.Formats;
import works.wtypes.schema.Keyword;

import static java.util.Objects.requireNonNull;

/**
 * A single schema keyword and its value, used to {@link Types#refine refine} another descriptor.
 * <p>
 * On its own, a constraint is a descriptor that checks only its keyword.
 * For example, {@code Constraint.minimum(3)} accepts {@code 5} and every non-number,
 * but rejects {@code 2}.
 * <p>
 * Where a keyword's value is a schema, the constraint holds a {@link TypeDescriptor} instead.
 * Malformed values are rejected when the constraint is created.
 */
public record Constraint(Keyword keyword, @Nullable Object value) implements TypeDescriptor {
	public Constraint {
		requireNonNull(keyword);
		value = copyOf(value);
		SchemaSynthesizer.constraintNode(keyword, value);
	}

	public static Constraint of(Keyword keyword, @Nullable Object value) {
		return new Constraint(keyword, value);
	}

	public static Constraint required(String... names) {
		return required(Arrays.asList(names));
	}

	public static Constraint required(Collection<String> names) {
		for (String name : names) {
			if (name == null || name.isBlank()) {
				throw new DefinitionError("Required field names can't be blank");
			}
		}
		return new Constraint(Keyword.REQUIRED, new ArrayList<>(names));
	}

	public static Constraint defaultValue(@Nullable Object value) {
		return new Constraint(Keyword.DEFAULT, value);
	}

	public static Constraint additionalProperties(boolean allowed) {
		return new Constraint(Keyword.ADDITIONAL_PROPERTIES, allowed ? Types.ANY : Types.NEVER);
	}

	public static Constraint additionalProperties(TypeDescriptor type) {
		return new Constraint(Keyword.ADDITIONAL_PROPERTIES, type);
	}

	public static Constraint properties(Map<String, ? extends TypeDescriptor> properties) {
		return new Constraint(Keyword.PROPERTIES, properties);
	}

	public static Constraint minProperties(int count) {
		return new Constraint(Keyword.MIN_PROPERTIES, count);
	}

	public static Constraint maxProperties(int count) {
		return new Constraint(Keyword.MAX_PROPERTIES, count);
	}

	public static Constraint minItems(int count) {
		return new Constraint(Keyword.MIN_ITEMS, count);
	}

	public static Constraint maxItems(int count) {
		return new Constraint(Keyword.MAX_ITEMS, count);
	}

	public static Constraint uniqueItems(boolean unique) {
		return new Constraint(Keyword.UNIQUE_ITEMS, unique);
	}

	public static Constraint minimum(Number bound) {
		return new Constraint(Keyword.MINIMUM, bound);
	}

	public static Constraint maximum(Number bound) {
		return new Constraint(Keyword.MAXIMUM, bound);
	}

	public static Constraint exclusiveMinimum(Number bound) {
		return new Constraint(Keyword.EXCLUSIVE_MINIMUM, bound);
	}

	public static Constraint exclusiveMaximum(Number bound) {
		return new Constraint(Keyword.EXCLUSIVE_MAXIMUM, bound);
	}

	public static Constraint multipleOf(Number factor) {
		return new Constraint(Keyword.MULTIPLE_OF, factor);
	}

	public static Constraint minLength(int length) {
		return new Constraint(Keyword.MIN_LENGTH, length);
	}

	public static Constraint maxLength(int length) {
		return new Constraint(Keyword.MAX_LENGTH, length);
	}

	/**
	 * @param regex matched anywhere within the string; use {@code ^} and {@code $} to anchor it
	 */
	public static Constraint pattern(String regex) {
		return new Constraint(Keyword.PATTERN, regex);
	}

	/**
	 * @param format one of the names in {@link Formats}, or any other name, which is then just an annotation
	 */
	public static Constraint format(String format) {
		return new Constraint(Keyword.FORMAT, format);
	}

	public static Constraint title(String title) {
		return new Constraint(Keyword.TITLE, title);
	}

	public static Constraint description(String description) {
		return new Constraint(Keyword.DESCRIPTION, description);
	}

	public static Constraint constant(@Nullable Object value) {
		return new Constraint(Keyword.CONST, value);
	}

	public static Constraint oneOfValues(Object... values) {
		return oneOfValues(Arrays.asList(values));
	}

	public static Constraint oneOfValues(Collection<?> values) {
		return new Constraint(Keyword.ENUM, new ArrayList<>(values));
	}

	private static @Nullable Object copyOf(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(k, copyOf(v)));
			return Collections.unmodifiableMap(result);
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			list.forEach(v -> result.add(copyOf(v)));
			return Collections.unmodifiableList(result);
		} else {
			return value;
		}
	}

	@Override
	public String toString() {
		return keyword + "=" + value;
	}
}
