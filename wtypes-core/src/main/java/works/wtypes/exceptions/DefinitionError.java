package works.wtypes.exceptions;

/**
 * A type descriptor, constraint, shape, or container was declared incorrectly.
 * <p>
 * Thrown when the declaration is made, not when a value is later validated.
 */
public final class DefinitionError extends WtypesException {
	public DefinitionError(String message) {
		super(message);
	}

	public DefinitionError(Throwable cause) {
		super(cause);
	}

	public DefinitionError(String message, Throwable cause) {
		super(message, cause);
	}
}
