package works.wtypes;

import static java.util.Objects.requireNonNull;

/**
 * Accepts instances of a native Java class, for values that have no JSON representation.
 */
public record InstanceOfType(Class<?> javaClass) implements TypeDescriptor {
	public InstanceOfType {
		requireNonNull(javaClass);
	}

	@Override
	public String toString() {
		return "instanceOf(" + javaClass.getSimpleName() + ")";
	}
}
