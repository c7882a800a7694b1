package works.wtypes.exceptions;

/**
 * Root of the exceptions thrown by the type system.
 * <p>
 * Data problems are {@link ValidationFailure}s;
 * declaration problems are {@link DefinitionError}s.
 */
public sealed abstract class WtypesException extends RuntimeException permits ValidationFailure, DefinitionError {
	protected WtypesException(String message) {
		super(message);
	}

	protected WtypesException(Throwable cause) {
		super(cause);
	}

	protected WtypesException(String message, Throwable cause) {
		super(message, cause);
	}
}
