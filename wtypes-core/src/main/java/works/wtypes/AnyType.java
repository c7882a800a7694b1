package works.wtypes;

/**
 * Accepts every value.
 */
public record AnyType() implements TypeDescriptor {
	@Override
	public String toString() {
		return "any";
	}
}
