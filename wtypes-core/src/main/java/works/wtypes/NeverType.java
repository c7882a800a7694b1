package works.wtypes;

/**
 * Accepts no value. Mostly useful as the {@link Shape#additionalProperties() additional-properties policy}
 * of a shape that forbids undeclared fields.
 */
public record NeverType() implements TypeDescriptor {
	@Override
	public String toString() {
		return "never";
	}
}
