package works.wtypes.containers;

import java.util.Collection;
import org.jetbrains.annotations.Nullable;
import works.wtypes.TypeDescriptor;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.Items;

/**
 * A {@link ListContainer} for a {@link works.wtypes.TupleType tuple type}:
 * a fixed number of items, each typed by its position.
 * <p>
 * Items can be replaced with {@link #set}, but since the length is fixed by the schema,
 * insertions and removals fail validation.
 */
public class TupleContainer extends ListContainer {
	public TupleContainer(TypeDescriptor type, @Nullable Collection<?> seed) {
		super(requirePositional(type), seed);
	}

	private static TypeDescriptor requirePositional(TypeDescriptor type) {
		if (!(type.schema().items().orElse(null) instanceof Items.Positional)) {
			throw new DefinitionError("TupleContainer requires positional item types, not " + type.schema());
		}
		return type;
	}

	public static TupleContainer from(TypeDescriptor type, @Nullable Object seed) {
		return new TupleContainer(type, requireArray(type, seed));
	}
}
