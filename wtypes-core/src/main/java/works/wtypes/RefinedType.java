package works.wtypes;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Values accepted by {@code base} that also satisfy every one of the {@code constraints}.
 */
public record RefinedType(TypeDescriptor base, List<Constraint> constraints) implements TypeDescriptor {
	public RefinedType {
		requireNonNull(base);
		constraints = List.copyOf(constraints);
	}
}
