package works.wtypes;

import static java.util.Objects.requireNonNull;

/**
 * Lists whose items all conform to {@code items}.
 */
public record ArrayType(TypeDescriptor items) implements TypeDescriptor {
	public ArrayType {
		requireNonNull(items);
	}
}
