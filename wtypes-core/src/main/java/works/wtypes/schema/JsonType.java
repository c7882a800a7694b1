package works.wtypes.schema;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The primitive types of the schema vocabulary, and how Java values map onto them.
 * <p>
 * Any {@link Map} is an object and any {@link List} is an array.
 * Any {@link Number} is a number, and it is also an integer if it has no fractional part.
 * Values of other classes have no JSON type; only schemas that
 * don't constrain the {@code type} (like {@code instanceOf}) can accept them.
 */
public enum JsonType {
	OBJECT("object"),
	ARRAY("array"),
	STRING("string"),
	INTEGER("integer"),
	NUMBER("number"),
	BOOLEAN("boolean"),
	NULL("null");

	private final String keyword;

	JsonType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	public static JsonType fromKeyword(String keyword) {
		for (JsonType t : values()) {
			if (t.keyword.equals(keyword)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown JSON type: \"" + keyword + "\"");
	}

	/**
	 * @return the most specific type of the given value, or null if it has none.
	 * Integral numbers report {@link #INTEGER}.
	 */
	public static @Nullable JsonType of(@Nullable Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof Boolean) {
			return BOOLEAN;
		} else if (value instanceof Number n) {
			return Values.isIntegral(n) ? INTEGER : NUMBER;
		} else if (value instanceof CharSequence) {
			return STRING;
		} else if (value instanceof Map) {
			return OBJECT;
		} else if (value instanceof List) {
			return ARRAY;
		} else {
			return null;
		}
	}

	public boolean matches(@Nullable Object value) {
		JsonType actual = of(value);
		if (actual == this) {
			return true;
		} else {
			return this == NUMBER && actual == INTEGER;
		}
	}

	/**
	 * Keywords for numbers also apply to integers.
	 */
	public boolean isCoveredBy(JsonType keywordTarget) {
		return this == keywordTarget || (keywordTarget == NUMBER && this == INTEGER);
	}

	@Override
	public String toString() {
		return keyword;
	}
}
