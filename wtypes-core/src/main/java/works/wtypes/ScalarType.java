package works.wtypes;

import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.JsonType;

import static java.util.Objects.requireNonNull;

/**
 * Values of a single primitive {@link JsonType}.
 */
public record ScalarType(JsonType type) implements TypeDescriptor {
	public ScalarType {
		requireNonNull(type);
		if (type == JsonType.OBJECT || type == JsonType.ARRAY) {
			throw new DefinitionError("Not a scalar type: " + type + "; use ObjectType or ArrayType");
		}
	}

	@Override
	public String toString() {
		return type.keyword();
	}
}
