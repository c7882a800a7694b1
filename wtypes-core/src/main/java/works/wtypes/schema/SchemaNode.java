package works.wtypes.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import org.jetbrains.annotations.Nullable;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;

import static java.util.Objects.requireNonNull;
import static works.wtypes.schema.Keyword.ADDITIONAL_PROPERTIES;
import static works.wtypes.schema.Keyword.ALL_OF;
import static works.wtypes.schema.Keyword.ANY_OF;
import static works.wtypes.schema.Keyword.DEFAULT;
import static works.wtypes.schema.Keyword.INSTANCE_OF;
import static works.wtypes.schema.Keyword.ITEMS;
import static works.wtypes.schema.Keyword.MAX_ITEMS;
import static works.wtypes.schema.Keyword.MAX_LENGTH;
import static works.wtypes.schema.Keyword.MAX_PROPERTIES;
import static works.wtypes.schema.Keyword.MIN_ITEMS;
import static works.wtypes.schema.Keyword.MIN_LENGTH;
import static works.wtypes.schema.Keyword.MIN_PROPERTIES;
import static works.wtypes.schema.Keyword.NOT;
import static works.wtypes.schema.Keyword.ONE_OF;
import static works.wtypes.schema.Keyword.PROPERTIES;
import static works.wtypes.schema.Keyword.REQUIRED;
import static works.wtypes.schema.Keyword.TYPE;

/**
 * The canonical, immutable schema document: a set of {@link Keyword}s and their values,
 * or one of the two boolean schemas {@link #ANY} and {@link #NOTHING}.
 * <p>
 * Nodes are only created through {@link Builder#build()}, which rejects keyword
 * combinations that can't apply to the same value (for example {@code minItems} on
 * an {@code integer}) and defaults that don't conform to their own schema.
 * Those are reported as {@link DefinitionError}s.
 * <p>
 * {@link #toMap()} renders the node using the JSON Schema vocabulary,
 * with keywords in {@link Keyword} declaration order.
 */
public final class SchemaNode {
	/**
	 * The {@code true} schema: accepts everything.
	 */
	public static final SchemaNode ANY = new SchemaNode(true, new EnumMap<>(Keyword.class));

	/**
	 * The {@code false} schema: accepts nothing.
	 */
	public static final SchemaNode NOTHING = new SchemaNode(false, new EnumMap<>(Keyword.class));

	private final boolean satisfiable;
	private final Map<Keyword, Object> keywords;

	private SchemaNode(boolean satisfiable, EnumMap<Keyword, Object> keywords) {
		this.satisfiable = satisfiable;
		this.keywords = Collections.unmodifiableMap(keywords);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static SchemaNode of(Keyword keyword, @Nullable Object value) {
		return builder().put(keyword, value).build();
	}

	public static SchemaNode ofType(JsonType type) {
		return of(TYPE, type);
	}

	public boolean isAny() {
		return satisfiable && keywords.isEmpty();
	}

	public boolean isNothing() {
		return !satisfiable;
	}

	public Set<Keyword> keywords() {
		return keywords.keySet();
	}

	public boolean has(Keyword keyword) {
		return keywords.containsKey(keyword);
	}

	/**
	 * @return the normalized value of {@code keyword}, or null if absent.
	 * Nested lists and maps are unmodifiable.
	 * Note that {@link Keyword#DEFAULT default} and {@link Keyword#CONST const}
	 * can legitimately be null; use {@link #has} to tell the difference.
	 */
	public @Nullable Object get(Keyword keyword) {
		return keywords.get(keyword);
	}

	public Optional<JsonType> type() {
		return Optional.ofNullable((JsonType) keywords.get(TYPE));
	}

	@SuppressWarnings("unchecked")
	public Map<String, SchemaNode> properties() {
		return (Map<String, SchemaNode>) keywords.getOrDefault(PROPERTIES, Map.of());
	}

	@SuppressWarnings("unchecked")
	public List<String> required() {
		return (List<String>) keywords.getOrDefault(REQUIRED, List.of());
	}

	/**
	 * @return the schema for object members not named in {@link #properties()};
	 * {@link #ANY} when the keyword is absent
	 */
	public SchemaNode additionalProperties() {
		return (SchemaNode) keywords.getOrDefault(ADDITIONAL_PROPERTIES, ANY);
	}

	public Optional<Items> items() {
		return Optional.ofNullable((Items) keywords.get(ITEMS));
	}

	@SuppressWarnings("unchecked")
	public List<SchemaNode> anyOf() {
		return (List<SchemaNode>) keywords.getOrDefault(ANY_OF, List.of());
	}

	@SuppressWarnings("unchecked")
	public List<SchemaNode> allOf() {
		return (List<SchemaNode>) keywords.getOrDefault(ALL_OF, List.of());
	}

	@SuppressWarnings("unchecked")
	public List<SchemaNode> oneOf() {
		return (List<SchemaNode>) keywords.getOrDefault(ONE_OF, List.of());
	}

	/**
	 * @return the schema a value must <em>not</em> conform to, if any
	 */
	public Optional<SchemaNode> not() {
		return Optional.ofNullable((SchemaNode) keywords.get(NOT));
	}

	public boolean hasDefault() {
		return keywords.containsKey(DEFAULT);
	}

	/**
	 * @return a fresh copy of the default value, so callers can't disturb this node
	 */
	public @Nullable Object defaultValue() {
		if (!hasDefault()) {
			throw new IllegalStateException("Schema has no default: " + this);
		}
		return Values.deepCopy(keywords.get(DEFAULT));
	}

	/**
	 * @return the schema that a member called {@code name} must conform to
	 */
	public SchemaNode propertySchema(String name) {
		SchemaNode declared = properties().get(name);
		return (declared == null) ? additionalProperties() : declared;
	}

	/**
	 * Combines this node with the given overlays according to each keyword's
	 * {@link Keyword.MergeRule merge rule}. All overlays are merged before the result is checked,
	 * so an intermediate combination is never judged on its own.
	 *
	 * @throws DefinitionError if the combined keywords are incompatible
	 */
	public SchemaNode refine(List<SchemaNode> overlays) {
		Builder builder = toBuilder();
		overlays.forEach(builder::merge);
		return builder.build();
	}

	public SchemaNode refine(SchemaNode... overlays) {
		return refine(List.of(overlays));
	}

	/**
	 * @return this node minus the given keywords, and minus its {@code default}
	 * if anything was removed. No checks are performed.
	 */
	public SchemaNode without(Keyword... toRemove) {
		if (!satisfiable) {
			return this;
		}
		EnumMap<Keyword, Object> result = copyOfKeywords();
		for (Keyword k : toRemove) {
			result.remove(k);
		}
		if (result.size() == keywords.size()) {
			return this;
		}
		result.remove(DEFAULT);
		return result.isEmpty() ? ANY : new SchemaNode(true, result);
	}

	public Builder toBuilder() {
		Builder result = new Builder();
		result.satisfiable = this.satisfiable;
		result.keywords.putAll(this.keywords);
		return result;
	}

	/**
	 * @return a plain nested mapping using the JSON Schema vocabulary
	 * @throws IllegalStateException for {@link #NOTHING}, which renders as {@code false}
	 * rather than a mapping; use {@link #render()} for that.
	 */
	public Map<String, Object> toMap() {
		if (!satisfiable) {
			throw new IllegalStateException("The false schema has no mapping form");
		}
		Map<String, Object> result = new LinkedHashMap<>();
		keywords.forEach((keyword, value) -> result.put(keyword.jsonName(), renderValue(keyword, value)));
		return result;
	}

	/**
	 * @return {@link Boolean#FALSE} for {@link #NOTHING}; otherwise {@link #toMap()}.
	 */
	public Object render() {
		return satisfiable ? toMap() : Boolean.FALSE;
	}

	private static @Nullable Object renderValue(Keyword keyword, @Nullable Object value) {
		return switch (keyword) {
			case TYPE -> ((JsonType) value).keyword();
			case INSTANCE_OF -> ((Class<?>) value).getName();
			case ANY_OF, ALL_OF, ONE_OF -> {
				List<Object> result = new ArrayList<>();
				((List<?>) value).forEach(n -> result.add(((SchemaNode) n).render()));
				yield result;
			}
			case PROPERTIES -> {
				Map<String, Object> result = new LinkedHashMap<>();
				((Map<?, ?>) value).forEach((name, n) -> result.put((String) name, ((SchemaNode) n).render()));
				yield result;
			}
			case REQUIRED -> new ArrayList<>((List<?>) value);
			case ADDITIONAL_PROPERTIES -> {
				SchemaNode node = (SchemaNode) value;
				yield node.isAny() ? Boolean.TRUE : node.render();
			}
			case NOT -> ((SchemaNode) value).render();
			case ITEMS -> ((Items) value).render();
			case MINIMUM, MAXIMUM, EXCLUSIVE_MINIMUM, EXCLUSIVE_MAXIMUM, MULTIPLE_OF -> simplify((BigDecimal) value);
			default -> Values.deepCopy(value);
		};
	}

	private static Number simplify(BigDecimal value) {
		if (value.scale() <= 0) {
			try {
				long l = value.longValueExact();
				if (l == (int) l) {
					return (int) l;
				}
				return l;
			} catch (ArithmeticException e) {
				return value;
			}
		}
		return value;
	}

	/**
	 * Parses the output of {@link #render()} (or any equivalent JSON value).
	 *
	 * @param json a {@link Boolean} or a {@link Map} with string keys
	 * @throws DefinitionError if the value is not a schema this library supports
	 */
	public static SchemaNode fromJson(@Nullable Object json) {
		if (json instanceof Boolean b) {
			return b ? ANY : NOTHING;
		} else if (json instanceof Map<?, ?> map) {
			Builder builder = builder();
			map.forEach((name, value) -> {
				Keyword keyword;
				try {
					keyword = Keyword.fromJsonName(String.valueOf(name));
				} catch (IllegalArgumentException e) {
					throw new DefinitionError(e.getMessage(), e);
				}
				builder.put(keyword, parseValue(keyword, value));
			});
			return builder.build();
		} else {
			throw new DefinitionError("A schema must be a boolean or an object, not " + json);
		}
	}

	private static @Nullable Object parseValue(Keyword keyword, @Nullable Object value) {
		switch (keyword) {
			case PROPERTIES -> {
				if (!(value instanceof Map<?, ?> map)) {
					throw new DefinitionError("\"properties\" must be an object");
				}
				Map<String, SchemaNode> result = new LinkedHashMap<>();
				map.forEach((name, node) -> result.put(String.valueOf(name), fromJson(node)));
				return result;
			}
			case ADDITIONAL_PROPERTIES, NOT -> {
				return fromJson(value);
			}
			case ITEMS -> {
				if (value instanceof List<?> list) {
					return new Items.Positional(parseList(list));
				}
				return new Items.Uniform(fromJson(value));
			}
			case ANY_OF, ALL_OF, ONE_OF -> {
				if (!(value instanceof List<?> list)) {
					throw new DefinitionError("\"" + keyword + "\" must be an array");
				}
				return parseList(list);
			}
			case INSTANCE_OF -> {
				try {
					return Class.forName(String.valueOf(value), false, Thread.currentThread().getContextClassLoader());
				} catch (ClassNotFoundException e) {
					throw new DefinitionError("Unknown instanceOf class: " + value, e);
				}
			}
			default -> {
				return value;
			}
		}
	}

	private static List<SchemaNode> parseList(List<?> list) {
		List<SchemaNode> result = new ArrayList<>(list.size());
		list.forEach(node -> result.add(fromJson(node)));
		return result;
	}

	private EnumMap<Keyword, Object> copyOfKeywords() {
		EnumMap<Keyword, Object> result = new EnumMap<>(Keyword.class);
		result.putAll(keywords);
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		SchemaNode that = (SchemaNode) o;
		return satisfiable == that.satisfiable && keywords.equals(that.keywords);
	}

	@Override
	public int hashCode() {
		return 31 * Boolean.hashCode(satisfiable) + keywords.hashCode();
	}

	@Override
	public String toString() {
		return String.valueOf(render());
	}

	/**
	 * Accumulates keywords, normalizing each value as it's {@link #put},
	 * and checks the combination in {@link #build()}.
	 */
	public static final class Builder {
		private boolean satisfiable = true;
		private final EnumMap<Keyword, Object> keywords = new EnumMap<>(Keyword.class);

		Builder() { }

		/**
		 * Sets (replaces) a keyword.
		 *
		 * @throws DefinitionError if {@code value} is not a legal value for {@code keyword}
		 */
		public Builder put(Keyword keyword, @Nullable Object value) {
			keywords.put(requireNonNull(keyword), normalize(keyword, value));
			return this;
		}

		/**
		 * Combines {@code overlay} into this builder using each keyword's merge rule.
		 */
		@SuppressWarnings("unchecked")
		public Builder merge(SchemaNode overlay) {
			if (overlay.isNothing()) {
				satisfiable = false;
				return this;
			}
			overlay.keywords.forEach((keyword, value) -> {
				Object existing = keywords.get(keyword);
				if (existing == null) {
					keywords.put(keyword, value);
					return;
				}
				switch (keyword.mergeRule()) {
					case OVERRIDE -> keywords.put(keyword, value);
					case UNION -> {
						Set<String> union = new LinkedHashSet<>((List<String>) existing);
						union.addAll((List<String>) value);
						keywords.put(keyword, List.copyOf(union));
					}
					case MERGE_BY_NAME -> {
						Map<String, SchemaNode> merged = new LinkedHashMap<>((Map<String, SchemaNode>) existing);
						merged.putAll((Map<String, SchemaNode>) value);
						keywords.put(keyword, Collections.unmodifiableMap(merged));
					}
				}
			});
			return this;
		}

		public SchemaNode build() {
			if (!satisfiable) {
				return NOTHING;
			}
			if (keywords.isEmpty()) {
				return ANY;
			}
			checkApplicability();
			checkBounds(MIN_ITEMS, MAX_ITEMS);
			checkBounds(MIN_LENGTH, MAX_LENGTH);
			checkBounds(MIN_PROPERTIES, MAX_PROPERTIES);
			SchemaNode result = new SchemaNode(true, new EnumMap<>(keywords));
			if (result.hasDefault()) {
				checkDefault(result);
			}
			return result;
		}

		private void checkApplicability() {
			if (keywords.containsKey(INSTANCE_OF)) {
				for (Keyword k : keywords.keySet()) {
					if (k == TYPE || k.appliesTo() != null) {
						throw new DefinitionError("Keyword \"" + k + "\" cannot be combined with \"instanceOf\"");
					}
				}
			}
			JsonType type = (JsonType) keywords.get(TYPE);
			if (type != null) {
				for (Keyword k : keywords.keySet()) {
					if (!k.appliesToType(type)) {
						throw new DefinitionError("Keyword \"" + k + "\" applies to " + k.appliesTo() + " values and cannot refine type " + type);
					}
				}
			}
		}

		private void checkBounds(Keyword minKeyword, Keyword maxKeyword) {
			Integer min = (Integer) keywords.get(minKeyword);
			Integer max = (Integer) keywords.get(maxKeyword);
			if (min != null && max != null && min > max) {
				throw new DefinitionError("\"" + minKeyword + "\" " + min + " exceeds \"" + maxKeyword + "\" " + max);
			}
		}

		private static void checkDefault(SchemaNode node) {
			try {
				SchemaValidator.validate(node.without(DEFAULT), node.keywords.get(DEFAULT));
			} catch (ValidationFailure e) {
				throw new DefinitionError("Default value does not conform to its schema: " + e.getMessage(), e);
			}
		}

		private static @Nullable Object normalize(Keyword keyword, @Nullable Object value) {
			switch (keyword) {
				case DEFAULT, CONST -> {
					return Values.freeze(value);
				}
				case ENUM -> {
					if (!(value instanceof Collection<?> c) || c.isEmpty()) {
						throw new DefinitionError("\"enum\" needs a non-empty list of values");
					}
					return Values.freeze(new ArrayList<>(c));
				}
				default -> {
					if (value == null) {
						throw new DefinitionError("Keyword \"" + keyword + "\" cannot be null");
					}
				}
			}
			return switch (keyword) {
				case TYPE -> requireType(value);
				case TITLE, DESCRIPTION, FORMAT -> requireString(keyword, value);
				case PATTERN -> requirePattern(value);
				case INSTANCE_OF -> {
					if (value instanceof Class<?>) {
						yield value;
					}
					throw new DefinitionError("\"instanceOf\" needs a class, not " + value);
				}
				case ANY_OF, ALL_OF, ONE_OF -> requireNodeList(keyword, value, false);
				case NOT -> {
					if (value instanceof Boolean b) {
						yield b ? ANY : NOTHING;
					} else if (value instanceof SchemaNode) {
						yield value;
					}
					throw new DefinitionError("\"not\" needs a boolean or a schema, not " + value);
				}
				case PROPERTIES -> requireProperties(value);
				case REQUIRED -> requireNames(value);
				case ADDITIONAL_PROPERTIES -> {
					if (value instanceof Boolean b) {
						yield b ? ANY : NOTHING;
					} else if (value instanceof SchemaNode) {
						yield value;
					}
					throw new DefinitionError("\"additionalProperties\" needs a boolean or a schema, not " + value);
				}
				case ITEMS -> {
					if (value instanceof Items) {
						yield value;
					} else if (value instanceof SchemaNode n) {
						yield new Items.Uniform(n);
					} else if (value instanceof List<?>) {
						yield new Items.Positional(requireNodeList(keyword, value, true));
					}
					throw new DefinitionError("\"items\" needs a schema or a list of schemas, not " + value);
				}
				case MIN_ITEMS, MAX_ITEMS, MIN_LENGTH, MAX_LENGTH, MIN_PROPERTIES, MAX_PROPERTIES -> requireCount(keyword, value);
				case UNIQUE_ITEMS -> {
					if (value instanceof Boolean) {
						yield value;
					}
					throw new DefinitionError("\"uniqueItems\" needs a boolean, not " + value);
				}
				case MINIMUM, MAXIMUM, EXCLUSIVE_MINIMUM, EXCLUSIVE_MAXIMUM, MULTIPLE_OF -> requireBound(keyword, value);
				case DEFAULT, CONST, ENUM -> throw new AssertionError("Unexpected keyword: " + keyword);
			};
		}

		private static JsonType requireType(Object value) {
			if (value instanceof JsonType t) {
				return t;
			}
			try {
				return JsonType.fromKeyword(String.valueOf(value));
			} catch (IllegalArgumentException e) {
				throw new DefinitionError(e.getMessage(), e);
			}
		}

		private static String requirePattern(Object value) {
			String regex = requireString(Keyword.PATTERN, value);
			try {
				Formats.compiledPattern(regex);
			} catch (PatternSyntaxException e) {
				throw new DefinitionError("Invalid pattern \"" + regex + "\"", e);
			}
			return regex;
		}

		private static Map<String, SchemaNode> requireProperties(Object value) {
			if (!(value instanceof Map<?, ?> map)) {
				throw new DefinitionError("\"properties\" needs a map of names to schemas");
			}
			Map<String, SchemaNode> result = new LinkedHashMap<>();
			map.forEach((name, node) -> {
				if (!(name instanceof String s) || s.isEmpty()) {
					throw new DefinitionError("Property names must be non-empty strings, not " + name);
				}
				if (!(node instanceof SchemaNode n)) {
					throw new DefinitionError("Property \"" + name + "\" needs a schema, not " + node);
				}
				result.put(s, n);
			});
			return Collections.unmodifiableMap(result);
		}

		private static List<String> requireNames(Object value) {
			if (!(value instanceof Collection<?> c)) {
				throw new DefinitionError("\"required\" needs a list of names");
			}
			Set<String> names = new LinkedHashSet<>();
			for (Object name : c) {
				if (!(name instanceof String s) || s.isEmpty()) {
					throw new DefinitionError("Required names must be non-empty strings, not " + name);
				}
				names.add(s);
			}
			return List.copyOf(names);
		}

		private static BigDecimal requireBound(Keyword keyword, Object value) {
			BigDecimal number = (value instanceof Number n) ? Values.toBigDecimal(n) : null;
			if (number == null) {
				throw new DefinitionError("\"" + keyword + "\" needs a finite number, not " + value);
			}
			if (keyword == Keyword.MULTIPLE_OF && number.signum() <= 0) {
				throw new DefinitionError("\"multipleOf\" must be positive, not " + value);
			}
			return (number.signum() == 0) ? BigDecimal.ZERO : number.stripTrailingZeros();
		}

		private static String requireString(Keyword keyword, Object value) {
			if (value instanceof String s) {
				return s;
			}
			throw new DefinitionError("\"" + keyword + "\" needs a string, not " + value);
		}

		private static Integer requireCount(Keyword keyword, Object value) {
			if (value instanceof Number n && Values.isIntegral(n)) {
				BigDecimal bd = Values.toBigDecimal(n);
				if (bd != null && bd.signum() >= 0 && bd.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0) {
					return bd.intValue();
				}
			}
			throw new DefinitionError("\"" + keyword + "\" needs a non-negative integer, not " + value);
		}

		private static List<SchemaNode> requireNodeList(Keyword keyword, Object value, boolean allowEmpty) {
			if (value instanceof List<?> list && (allowEmpty || !list.isEmpty())) {
				List<SchemaNode> result = new ArrayList<>(list.size());
				for (Object node : list) {
					if (!(node instanceof SchemaNode n)) {
						throw new DefinitionError("\"" + keyword + "\" entries must be schemas, not " + node);
					}
					result.add(n);
				}
				return List.copyOf(result);
			}
			throw new DefinitionError("\"" + keyword + "\" needs a " + (allowEmpty ? "" : "non-empty ") + "list of schemas");
		}
	}
}
