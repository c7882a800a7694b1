package works.wtypes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.Values;

import static java.util.Objects.requireNonNull;

/**
 * The declared fields of an {@link ObjectType}, in declaration order,
 * plus the policy for fields that aren't declared.
 * <p>
 * Shapes are built with {@link #builder()}, or with {@link #extending} to start from
 * another shape's fields, the way a subclass adds to its superclass.
 *
 * @param additionalProperties the type of undeclared fields:
 *                             {@link AnyType} allows anything and {@link NeverType} forbids them
 */
public record Shape(List<Field> fields, TypeDescriptor additionalProperties) {
	public static final Shape EMPTY = new Shape(List.of(), new AnyType());

	public Shape {
		fields = List.copyOf(fields);
		requireNonNull(additionalProperties);
		Set<String> names = new HashSet<>();
		for (Field f : fields) {
			if (!names.add(f.name())) {
				throw new DefinitionError("Field \"" + f.name() + "\" declared twice");
			}
		}
	}

	/**
	 * @param hasDefault distinguishes a null default from no default at all
	 */
	public record Field(String name, TypeDescriptor type, boolean hasDefault, @Nullable Object defaultValue) {
		public Field {
			requireNonNull(name);
			requireNonNull(type);
			if (name.isBlank()) {
				throw new DefinitionError("Field name can't be blank");
			}
			if (!hasDefault && defaultValue != null) {
				throw new IllegalArgumentException("Field \"" + name + "\" has a default value but hasDefault is false");
			}
		}

		public static Field of(String name, TypeDescriptor type) {
			return new Field(name, type, false, null);
		}

		public static Field withDefault(String name, TypeDescriptor type, @Nullable Object defaultValue) {
			return new Field(name, type, true, Values.freeze(defaultValue));
		}
	}

	public static Builder builder() {
		return new Builder(EMPTY);
	}

	/**
	 * @return a builder starting with all of {@code parent}'s fields and its additional-properties policy.
	 * Declaring a field with the same name as one of the parent's replaces it in place;
	 * new fields are appended.
	 */
	public static Builder extending(Shape parent) {
		return new Builder(parent);
	}

	public Optional<Field> field(String name) {
		return fields.stream().filter(f -> f.name().equals(name)).findFirst();
	}

	public List<String> fieldNames() {
		return fields.stream().map(Field::name).toList();
	}

	public static final class Builder {
		private final Map<String, Field> fields = new LinkedHashMap<>();
		private final Set<String> declaredHere = new HashSet<>();
		private TypeDescriptor additionalProperties;

		private Builder(Shape parent) {
			parent.fields().forEach(f -> fields.put(f.name(), f));
			this.additionalProperties = parent.additionalProperties();
		}

		public Builder field(String name, TypeDescriptor type) {
			return add(Field.of(name, type));
		}

		public Builder field(String name, TypeDescriptor type, @Nullable Object defaultValue) {
			return add(Field.withDefault(name, type, defaultValue));
		}

		public Builder add(Field field) {
			if (!declaredHere.add(field.name())) {
				throw new DefinitionError("Field \"" + field.name() + "\" declared twice");
			}
			// LinkedHashMap keeps the original position when replacing
			fields.put(field.name(), field);
			return this;
		}

		public Builder additionalProperties(boolean allowed) {
			return additionalProperties(allowed ? Types.ANY : Types.NEVER);
		}

		public Builder additionalProperties(TypeDescriptor type) {
			this.additionalProperties = requireNonNull(type);
			return this;
		}

		public Shape build() {
			if (fields.isEmpty() && additionalProperties instanceof NeverType) {
				LOGGER.warn("Shape declares no fields and forbids additional ones; it accepts only empty objects");
			}
			return new Shape(new ArrayList<>(fields.values()), additionalProperties);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Shape.class);
}
