package works.wtypes.containers;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.TypeDescriptor;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.Items;
import works.wtypes.schema.JsonType;
import works.wtypes.schema.SchemaNode;
import works.wtypes.schema.SchemaValidator;
import works.wtypes.schema.ValuePath;
import works.wtypes.schema.Values;

import static java.util.Objects.requireNonNull;
import static works.wtypes.schema.Keyword.DEFAULT;
import static works.wtypes.schema.Keyword.ITEMS;
import static works.wtypes.schema.Keyword.TYPE;

/**
 * A mutable {@link List} whose contents always conform to the schema of an array {@link TypeDescriptor}.
 * <p>
 * Each mutation builds the complete candidate contents, validates the items that changed
 * along with the array-wide keywords like {@code minItems} and {@code uniqueItems},
 * and only then replaces the current contents. A failed mutation changes nothing;
 * in particular, {@link #addAll} with one bad element adds none of them.
 * <p>
 * When items are typed by position, an insertion or removal shifts every later item,
 * so all of those are revalidated.
 * <p>
 * Items are copied on the way in, and nested lists and maps are stored unmodifiable.
 * <p>
 * Not thread-safe.
 */
public class ListContainer extends AbstractList<Object> implements RandomAccess {
	private final TypeDescriptor type;
	private final SchemaNode schema;
	private final SchemaNode arrayLevelSchema;
	private final boolean positional;
	private PVector<Object> items;

	public ListContainer(TypeDescriptor type) {
		this(type, null);
	}

	/**
	 * @param seed the initial items; if null, the schema's own default (if any) is used instead
	 * @throws ValidationFailure if the items don't conform to the schema
	 * @throws DefinitionError if {@code type} doesn't describe arrays
	 */
	public ListContainer(TypeDescriptor type, @Nullable Collection<?> seed) {
		this.type = requireNonNull(type);
		this.schema = type.schema();
		if (schema.type().orElse(null) != JsonType.ARRAY) {
			throw new DefinitionError(getClass().getSimpleName() + " requires an array type, not " + schema);
		}
		this.arrayLevelSchema = schema.without(TYPE, ITEMS);
		this.positional = schema.items().orElse(null) instanceof Items.Positional;

		List<Object> initial = new ArrayList<>();
		if (seed != null) {
			seed.forEach(item -> initial.add(Values.freeze(item)));
		} else if (schema.hasDefault()) {
			initial.addAll((List<?>) schema.get(DEFAULT));
		}
		SchemaValidator.validate(schema, initial, ValuePath.ROOT);
		this.items = TreePVector.from(initial);
	}

	/**
	 * @return a container built from a value of unknown kind, such as parsed configuration
	 * @throws ValidationFailure at {@code $} if {@code seed} isn't a list
	 */
	public static ListContainer from(TypeDescriptor type, @Nullable Object seed) {
		return new ListContainer(type, requireArray(type, seed));
	}

	static List<?> requireArray(TypeDescriptor type, @Nullable Object seed) {
		if (seed instanceof List<?> list) {
			return list;
		}
		throw new ValidationFailure(ValuePath.ROOT, "expected " + JsonType.ARRAY, type.schema(), seed);
	}

	public TypeDescriptor type() {
		return type;
	}

	public SchemaNode schema() {
		return schema;
	}

	/**
	 * @return true if each item's schema depends on its position
	 */
	public boolean isPositional() {
		return positional;
	}

	@Override
	public Object get(int index) {
		return items.get(index);
	}

	@Override
	public int size() {
		return items.size();
	}

	@Override
	public boolean add(Object element) {
		add(items.size(), element);
		return true;
	}

	@Override
	public void add(int index, Object element) {
		checkPositionIndex(index);
		commit(items.plus(index, Values.freeze(element)), index, index + 1);
	}

	@Override
	public boolean addAll(Collection<?> elements) {
		return addAll(items.size(), elements);
	}

	@Override
	public boolean addAll(int index, Collection<?> elements) {
		checkPositionIndex(index);
		if (elements.isEmpty()) {
			return false;
		}
		List<Object> frozen = new ArrayList<>(elements.size());
		elements.forEach(item -> frozen.add(Values.freeze(item)));
		commit(items.plusAll(index, frozen), index, index + frozen.size());
		return true;
	}

	@Override
	public Object set(int index, Object element) {
		Objects.checkIndex(index, items.size());
		Object prior = items.get(index);
		commit(items.with(index, Values.freeze(element)), index, index + 1);
		return prior;
	}

	@Override
	public Object remove(int index) {
		Objects.checkIndex(index, items.size());
		Object prior = items.get(index);
		commit(items.minus(index), index, index);
		return prior;
	}

	@Override
	protected void removeRange(int fromIndex, int toIndex) {
		if (fromIndex >= toIndex) {
			return;
		}
		List<Object> candidate = new ArrayList<>(items.size() - (toIndex - fromIndex));
		candidate.addAll(items.subList(0, fromIndex));
		candidate.addAll(items.subList(toIndex, items.size()));
		commit(TreePVector.from(candidate), fromIndex, fromIndex);
	}

	@Override
	public boolean removeIf(Predicate<? super Object> filter) {
		requireNonNull(filter);
		List<Object> candidate = new ArrayList<>(items.size());
		int firstRemoved = -1;
		for (int i = 0; i < items.size(); i++) {
			Object item = items.get(i);
			if (filter.test(item)) {
				if (firstRemoved < 0) {
					firstRemoved = i;
				}
			} else {
				candidate.add(item);
			}
		}
		if (firstRemoved < 0) {
			return false;
		}
		commit(TreePVector.from(candidate), firstRemoved, firstRemoved);
		return true;
	}

	@Override
	public boolean removeAll(Collection<?> elements) {
		requireNonNull(elements);
		return removeIf(elements::contains);
	}

	@Override
	public boolean retainAll(Collection<?> elements) {
		requireNonNull(elements);
		return removeIf(item -> !elements.contains(item));
	}

	@Override
	public void replaceAll(UnaryOperator<Object> operator) {
		requireNonNull(operator);
		List<Object> candidate = new ArrayList<>(items.size());
		items.forEach(item -> candidate.add(Values.freeze(operator.apply(item))));
		commit(TreePVector.from(candidate), 0, candidate.size());
	}

	@Override
	public void sort(@Nullable Comparator<? super Object> comparator) {
		List<Object> candidate = new ArrayList<>(items);
		candidate.sort(comparator);
		commit(TreePVector.from(candidate), 0, candidate.size());
	}

	@Override
	public void clear() {
		commit(TreePVector.empty(), 0, 0);
	}

	/**
	 * Validates {@code candidate} and, if it passes, makes it the current contents.
	 *
	 * @param changedFrom index of the first item that differs from the current contents
	 * @param changedTo index after the last item that differs, ignoring positions shifted by an insertion or removal
	 */
	private void commit(PVector<Object> candidate, int changedFrom, int changedTo) {
		int validateTo = positional ? candidate.size() : changedTo;
		SchemaValidator.validateItems(schema, candidate, changedFrom, validateTo, ValuePath.ROOT);
		SchemaValidator.validate(arrayLevelSchema, candidate, ValuePath.ROOT);
		items = candidate;
		modCount++;
		LOGGER.trace("Committed {} items; changed from index {}", candidate.size(), changedFrom);
	}

	private void checkPositionIndex(int index) {
		if (index < 0 || index > items.size()) {
			throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + items.size());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ListContainer.class);
}
