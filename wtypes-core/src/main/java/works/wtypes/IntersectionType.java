package works.wtypes;

import java.util.List;
import works.wtypes.exceptions.DefinitionError;

/**
 * Values accepted by every one of the {@code operands}.
 */
public record IntersectionType(List<TypeDescriptor> operands) implements TypeDescriptor {
	public IntersectionType {
		operands = List.copyOf(operands);
		if (operands.isEmpty()) {
			throw new DefinitionError("An intersection needs at least one operand");
		}
	}
}
