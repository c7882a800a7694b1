package works.wtypes;

import java.util.List;
import works.wtypes.exceptions.DefinitionError;

/**
 * Values accepted by at least one of the {@code operands}.
 */
public record UnionType(List<TypeDescriptor> operands) implements TypeDescriptor {
	public UnionType {
		operands = List.copyOf(operands);
		if (operands.isEmpty()) {
			throw new DefinitionError("A union needs at least one operand");
		}
	}
}
