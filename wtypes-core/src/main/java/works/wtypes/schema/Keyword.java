package works.wtypes.schema;

import org.jetbrains.annotations.Nullable;

/**
 * The fixed catalogue of schema keywords understood by {@link SchemaNode}.
 * <p>
 * Declaration order is the canonical rendering order.
 */
public enum Keyword {
	TYPE("type", null, MergeRule.OVERRIDE),
	TITLE("title", null, MergeRule.OVERRIDE),
	DESCRIPTION("description", null, MergeRule.OVERRIDE),
	INSTANCE_OF("instanceOf", null, MergeRule.OVERRIDE),
	ANY_OF("anyOf", null, MergeRule.OVERRIDE),
	ALL_OF("allOf", null, MergeRule.OVERRIDE),
	ONE_OF("oneOf", null, MergeRule.OVERRIDE),
	NOT("not", null, MergeRule.OVERRIDE),
	CONST("const", null, MergeRule.OVERRIDE),
	ENUM("enum", null, MergeRule.OVERRIDE),

	PROPERTIES("properties", JsonType.OBJECT, MergeRule.MERGE_BY_NAME),
	REQUIRED("required", JsonType.OBJECT, MergeRule.UNION),
	ADDITIONAL_PROPERTIES("additionalProperties", JsonType.OBJECT, MergeRule.OVERRIDE),
	MIN_PROPERTIES("minProperties", JsonType.OBJECT, MergeRule.OVERRIDE),
	MAX_PROPERTIES("maxProperties", JsonType.OBJECT, MergeRule.OVERRIDE),

	ITEMS("items", JsonType.ARRAY, MergeRule.OVERRIDE),
	MIN_ITEMS("minItems", JsonType.ARRAY, MergeRule.OVERRIDE),
	MAX_ITEMS("maxItems", JsonType.ARRAY, MergeRule.OVERRIDE),
	UNIQUE_ITEMS("uniqueItems", JsonType.ARRAY, MergeRule.OVERRIDE),

	MINIMUM("minimum", JsonType.NUMBER, MergeRule.OVERRIDE),
	MAXIMUM("maximum", JsonType.NUMBER, MergeRule.OVERRIDE),
	EXCLUSIVE_MINIMUM("exclusiveMinimum", JsonType.NUMBER, MergeRule.OVERRIDE),
	EXCLUSIVE_MAXIMUM("exclusiveMaximum", JsonType.NUMBER, MergeRule.OVERRIDE),
	MULTIPLE_OF("multipleOf", JsonType.NUMBER, MergeRule.OVERRIDE),

	MIN_LENGTH("minLength", JsonType.STRING, MergeRule.OVERRIDE),
	MAX_LENGTH("maxLength", JsonType.STRING, MergeRule.OVERRIDE),
	PATTERN("pattern", JsonType.STRING, MergeRule.OVERRIDE),
	FORMAT("format", JsonType.STRING, MergeRule.OVERRIDE),

	DEFAULT("default", null, MergeRule.OVERRIDE),
	;

	private final String jsonName;
	private final JsonType appliesTo;
	private final MergeRule mergeRule;

	Keyword(String jsonName, @Nullable JsonType appliesTo, MergeRule mergeRule) {
		this.jsonName = jsonName;
		this.appliesTo = appliesTo;
		this.mergeRule = mergeRule;
	}

	public String jsonName() {
		return jsonName;
	}

	/**
	 * @return the only type whose values this keyword constrains,
	 * or null if it constrains values of any type.
	 */
	public @Nullable JsonType appliesTo() {
		return appliesTo;
	}

	public MergeRule mergeRule() {
		return mergeRule;
	}

	public boolean appliesToType(JsonType type) {
		return appliesTo == null || type.isCoveredBy(appliesTo);
	}

	public static Keyword fromJsonName(String name) {
		for (Keyword k : values()) {
			if (k.jsonName.equals(name)) {
				return k;
			}
		}
		throw new IllegalArgumentException("Unsupported schema keyword: \"" + name + "\"");
	}

	/**
	 * How a refinement combines its value for a keyword with the base value.
	 */
	public enum MergeRule {
		/**
		 * The refinement's value replaces the base value.
		 */
		OVERRIDE,

		/**
		 * Names from both are kept, in order of first appearance.
		 */
		UNION,

		/**
		 * Entries from both are kept; for names in both, the refinement's entry wins.
		 */
		MERGE_BY_NAME,
	}

	@Override
	public String toString() {
		return jsonName;
	}
}
