package works.wtypes;

import java.util.List;
import works.wtypes.exceptions.DefinitionError;

/**
 * Values accepted by exactly one of the {@code operands}.
 */
public record ExclusiveUnionType(List<TypeDescriptor> operands) implements TypeDescriptor {
	public ExclusiveUnionType {
		operands = List.copyOf(operands);
		if (operands.isEmpty()) {
			throw new DefinitionError("An exclusive union needs at least one operand");
		}
	}
}
