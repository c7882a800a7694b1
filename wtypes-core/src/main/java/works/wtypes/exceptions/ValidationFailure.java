package works.wtypes.exceptions;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.wtypes.schema.JsonType;
import works.wtypes.schema.SchemaNode;
import works.wtypes.schema.ValuePath;

import static java.util.Objects.requireNonNull;

/**
 * A value does not conform to the schema it was checked against.
 * <p>
 * Carries the {@link #path() path} to the offending field or item,
 * the schema fragment that rejected it, and the rejected value.
 * A failure of an {@code anyOf} or {@code oneOf} that no alternative matched lists the failure of each alternative
 * in {@link #causes()}.
 */
public final class ValidationFailure extends WtypesException {
	private final ValuePath path;
	private final String reason;
	private final SchemaNode expected;
	private final transient Object actual;
	private final List<ValidationFailure> causes;

	public ValidationFailure(ValuePath path, String reason, SchemaNode expected, @Nullable Object actual) {
		this(path, reason, expected, actual, List.of());
	}

	public ValidationFailure(ValuePath path, String reason, SchemaNode expected, @Nullable Object actual, List<ValidationFailure> causes) {
		super(fullMessage(path, reason, actual));
		this.path = requireNonNull(path);
		this.reason = requireNonNull(reason);
		this.expected = requireNonNull(expected);
		this.actual = actual;
		this.causes = List.copyOf(causes);
		causes.forEach(this::addSuppressed);
	}

	public ValuePath path() {
		return path;
	}

	public String reason() {
		return reason;
	}

	public SchemaNode expected() {
		return expected;
	}

	public @Nullable Object actual() {
		return actual;
	}

	public List<ValidationFailure> causes() {
		return causes;
	}

	/**
	 * @return the JSON kind of {@link #actual()}, or its Java class name if it has none
	 */
	public String actualKind() {
		return kindOf(actual);
	}

	private static String fullMessage(ValuePath path, String reason, @Nullable Object actual) {
		return path + ": " + reason + " (actual " + kindOf(actual) + ": " + preview(actual) + ")";
	}

	private static String kindOf(@Nullable Object value) {
		JsonType type = JsonType.of(value);
		return (type == null) ? value.getClass().getName() : type.keyword();
	}

	private static String preview(@Nullable Object value) {
		String text = String.valueOf(value);
		return (text.length() <= 60) ? text : text.substring(0, 57) + "...";
	}
}
