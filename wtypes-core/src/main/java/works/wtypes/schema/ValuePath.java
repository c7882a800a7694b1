package works.wtypes.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Location of a value within a nested structure, rendered in dot/bracket notation
 * rooted at {@code $}: for example {@code $.server.ports[2]}.
 *
 * @param segments each one is either a {@link String} property name or an {@link Integer} index
 */
public record ValuePath(List<Object> segments) {
	public static final ValuePath ROOT = new ValuePath(List.of());

	public ValuePath {
		segments = List.copyOf(segments);
		for (Object segment : segments) {
			if (!(segment instanceof String) && !(segment instanceof Integer)) {
				throw new IllegalArgumentException("Invalid path segment: " + segment);
			}
		}
	}

	public static ValuePath of(Object... segments) {
		return new ValuePath(List.of(segments));
	}

	public ValuePath then(String name) {
		return append(requireNonNull(name));
	}

	public ValuePath then(int index) {
		return append(index);
	}

	/**
	 * @return this path followed by all the segments of {@code suffix}
	 */
	public ValuePath then(ValuePath suffix) {
		if (suffix.isRoot()) {
			return this;
		}
		List<Object> result = new ArrayList<>(segments);
		result.addAll(suffix.segments);
		return new ValuePath(result);
	}

	private ValuePath append(Object segment) {
		List<Object> result = new ArrayList<>(segments.size() + 1);
		result.addAll(segments);
		result.add(segment);
		return new ValuePath(result);
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public Object lastSegment() {
		if (segments.isEmpty()) {
			throw new IllegalStateException("Root path has no segments");
		}
		return segments.get(segments.size() - 1);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("$");
		for (Object segment : segments) {
			if (segment instanceof Integer) {
				sb.append('[').append(segment).append(']');
			} else if (SIMPLE_NAME.matcher((String) segment).matches()) {
				sb.append('.').append(segment);
			} else {
				sb.append("['").append(((String) segment).replace("'", "\\'")).append("']");
			}
		}
		return sb.toString();
	}

	private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$-]*");
}
