package works.wtypes;

import static java.util.Objects.requireNonNull;

/**
 * Values that {@code operand} rejects.
 */
public record ComplementType(TypeDescriptor operand) implements TypeDescriptor {
	public ComplementType {
		requireNonNull(operand);
	}
}
