package works.wtypes.containers;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.TypeDescriptor;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.JsonType;
import works.wtypes.schema.SchemaNode;
import works.wtypes.schema.SchemaValidator;
import works.wtypes.schema.ValuePath;
import works.wtypes.schema.Values;

import static java.util.Objects.requireNonNull;
import static works.wtypes.schema.Keyword.ADDITIONAL_PROPERTIES;
import static works.wtypes.schema.Keyword.DEFAULT;
import static works.wtypes.schema.Keyword.PROPERTIES;
import static works.wtypes.schema.Keyword.TYPE;

/**
 * A mutable {@link Map} whose contents always conform to the schema of an object {@link TypeDescriptor}.
 * <p>
 * Missing fields that have defaults are filled in at construction time.
 * Every mutation is validated before it takes effect,
 * and a mutation that fails validation leaves the map unchanged.
 * The {@link #entrySet()}, {@link #keySet()} and {@link #values()} views are read-only.
 * Incoming values are copied on the way in, and nested lists and maps are stored unmodifiable,
 * so neither the caller's original nor anything returned by {@link #get} can change the contents.
 * <p>
 * Not thread-safe.
 */
public class DictContainer extends AbstractMap<String, Object> {
	private final TypeDescriptor type;
	private final SchemaNode schema;

	/**
	 * The object-wide keywords of {@link #schema}, like {@code required} and {@code maxProperties},
	 * which must be checked against the whole map after any change.
	 */
	private final SchemaNode objectLevelSchema;

	private final Map<String, Object> fields = new LinkedHashMap<>();

	public DictContainer(TypeDescriptor type) {
		this(type, null);
	}

	/**
	 * @param seed the initial fields; if null, the schema's own default (if any) is used instead
	 * @throws ValidationFailure if the resulting fields don't conform to the schema
	 * @throws DefinitionError if {@code type} doesn't describe objects
	 */
	public DictContainer(TypeDescriptor type, @Nullable Map<String, ?> seed) {
		this.type = requireNonNull(type);
		this.schema = type.schema();
		if (schema.type().orElse(null) != JsonType.OBJECT) {
			throw new DefinitionError(getClass().getSimpleName() + " requires an object type, not " + schema);
		}
		this.objectLevelSchema = schema.without(TYPE, PROPERTIES, ADDITIONAL_PROPERTIES);

		Map<Object, Object> candidate = new LinkedHashMap<>();
		if (seed != null) {
			seed.forEach((k, v) -> candidate.put(k, Values.freeze(v)));
		} else if (schema.hasDefault()) {
			if (schema.get(DEFAULT) instanceof Map<?, ?> m) {
				candidate.putAll(m);
			}
		}
		schema.properties().forEach((name, propertySchema) -> {
			if (propertySchema.hasDefault() && !candidate.containsKey(name)) {
				candidate.put(name, propertySchema.get(DEFAULT));
			}
		});
		SchemaValidator.validate(schema, candidate, ValuePath.ROOT);
		candidate.forEach((k, v) -> fields.put((String) k, v));
	}

	/**
	 * @return a container built from a value of unknown kind, such as parsed configuration
	 * @throws ValidationFailure at {@code $} if {@code seed} isn't a mapping
	 */
	public static DictContainer from(TypeDescriptor type, @Nullable Object seed) {
		return new DictContainer(type, requireObject(type, seed));
	}

	@SuppressWarnings("unchecked")
	protected static Map<String, ?> requireObject(TypeDescriptor type, @Nullable Object seed) {
		if (seed instanceof Map<?, ?> m) {
			return (Map<String, ?>) m;
		}
		throw new ValidationFailure(ValuePath.ROOT, "expected " + JsonType.OBJECT, type.schema(), seed);
	}

	public TypeDescriptor type() {
		return type;
	}

	public SchemaNode schema() {
		return schema;
	}

	@Override
	public Set<Entry<String, Object>> entrySet() {
		return Collections.unmodifiableMap(fields).entrySet();
	}

	@Override
	public int size() {
		return fields.size();
	}

	@Override
	public boolean containsKey(Object key) {
		return fields.containsKey(key);
	}

	@Override
	public Object get(Object key) {
		return fields.get(key);
	}

	@Override
	public Object put(String key, Object value) {
		return setField(key, value);
	}

	@Override
	public Object remove(Object key) {
		if (!fields.containsKey(key)) {
			return null;
		}
		String name = (String) key;
		Map<String, Object> candidate = new LinkedHashMap<>(fields);
		candidate.remove(name);
		checkObjectLevel(candidate);
		Object prior = fields.remove(name);
		LOGGER.trace("Removed {}", name);
		afterChange(name, prior, null);
		return prior;
	}

	@Override
	public void putAll(Map<? extends String, ?> updates) {
		Map<String, Object> frozen = frozenCopy(updates);
		checkFields(frozen);
		commitAll(frozen);
	}

	@Override
	public void clear() {
		checkObjectLevel(Map.of());
		Map<String, Object> prior = new LinkedHashMap<>(fields);
		fields.clear();
		LOGGER.trace("Cleared {} fields", prior.size());
		prior.forEach((name, value) -> afterChange(name, value, null));
	}

	@Override
	public void replaceAll(BiFunction<? super String, ? super Object, ?> function) {
		Map<String, Object> updates = new LinkedHashMap<>();
		fields.forEach((name, value) -> updates.put(name, function.apply(name, value)));
		putAll(updates);
	}

	/**
	 * The single path through which every field assignment passes.
	 *
	 * @return the prior value, or null if there was none
	 * @throws ValidationFailure if the assignment would leave the map invalid,
	 * in which case the map is unchanged
	 */
	protected Object setField(String key, @Nullable Object value) {
		Object frozen = Values.freeze(value);
		checkField(key, frozen);
		return commit(key, frozen);
	}

	/**
	 * Checks whether {@link #put put(key, value)} would succeed, without changing anything.
	 */
	public void checkField(String key, @Nullable Object value) {
		requireNonNull(key);
		SchemaValidator.validateEntry(schema, key, value, ValuePath.ROOT);
		if (!objectLevelSchema.isAny()) {
			Map<String, Object> candidate = new LinkedHashMap<>(fields);
			candidate.put(key, value);
			checkObjectLevel(candidate);
		}
	}

	/**
	 * Checks whether {@link #putAll putAll(updates)} would succeed, without changing anything.
	 */
	public void checkFields(Map<? extends String, ?> updates) {
		Map<String, Object> candidate = new LinkedHashMap<>(fields);
		updates.forEach((key, value) -> {
			SchemaValidator.validateEntry(schema, requireNonNull(key), value, ValuePath.ROOT);
			candidate.put(key, value);
		});
		checkObjectLevel(candidate);
	}

	/**
	 * Applies an assignment that has already been checked.
	 * The value must already have been through {@link Values#freeze}.
	 */
	protected final Object commit(String key, @Nullable Object value) {
		boolean existed = fields.containsKey(key);
		Object prior = fields.put(key, value);
		LOGGER.trace("Set {} = {}", key, value);
		afterChange(key, existed ? prior : null, value);
		return prior;
	}

	/**
	 * Applies assignments that have already been checked, in iteration order.
	 * The values must already have been through {@link Values#freeze}.
	 */
	protected final void commitAll(Map<? extends String, ?> updates) {
		List<Entry<String, Object>> changes = new ArrayList<>(updates.size());
		updates.forEach((key, value) -> changes.add(new SimpleImmutableEntry<>(key, fields.put(key, value))));
		LOGGER.trace("Set {} fields", changes.size());
		changes.forEach(change -> afterChange(change.getKey(), change.getValue(), updates.get(change.getKey())));
	}

	/**
	 * Called after each committed change to a field, including removal.
	 * Subclasses can override this to react to changes.
	 *
	 * @param oldValue null if the field was absent
	 * @param newValue null if the field was removed
	 */
	protected void afterChange(String key, @Nullable Object oldValue, @Nullable Object newValue) {
	}

	/**
	 * @return {@code updates} in iteration order, with each value {@link Values#freeze frozen}
	 */
	protected static Map<String, Object> frozenCopy(Map<? extends String, ?> updates) {
		Map<String, Object> result = new LinkedHashMap<>();
		updates.forEach((key, value) -> result.put(requireNonNull(key), Values.freeze(value)));
		return result;
	}

	private void checkObjectLevel(Map<String, Object> candidate) {
		SchemaValidator.validate(objectLevelSchema, candidate, ValuePath.ROOT);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DictContainer.class);
}
