package works.wtypes;

import static java.util.Objects.requireNonNull;

/**
 * Mappings whose fields are described by a {@link Shape}.
 */
public record ObjectType(Shape shape) implements TypeDescriptor {
	public ObjectType {
		requireNonNull(shape);
	}
}
