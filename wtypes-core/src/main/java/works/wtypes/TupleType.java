package works.wtypes;

import java.util.List;

/**
 * Fixed-length lists whose item at each position conforms to the descriptor at that position.
 */
public record TupleType(List<TypeDescriptor> items) implements TypeDescriptor {
	public TupleType {
		items = List.copyOf(items);
	}
}
