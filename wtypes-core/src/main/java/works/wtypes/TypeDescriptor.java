package works.wtypes;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.SchemaNode;
import works.wtypes.schema.SchemaValidator;

/**
 * An immutable classifier of values, from which a {@link SchemaNode} is derived.
 * <p>
 * Descriptors are values: two descriptors built the same way are equal,
 * and combining descriptors (see {@link Types#union}, {@link Types#allOf}, {@link Types#oneOf},
 * {@link Types#not} and {@link Types#refine})
 * creates a new one without modifying its operands.
 */
public sealed interface TypeDescriptor permits
	ScalarType,
	AnyType,
	NeverType,
	InstanceOfType,
	ObjectType,
	ArrayType,
	TupleType,
	UnionType,
	IntersectionType,
	ExclusiveUnionType,
	ComplementType,
	RefinedType,
	Constraint
{
	/**
	 * @return the schema document for this descriptor, computed once per distinct descriptor.
	 */
	default SchemaNode schema() {
		return SchemaSynthesizer.schemaFor(this);
	}

	/**
	 * @return {@link #schema()} as a plain nested mapping
	 * @throws IllegalStateException for descriptors that accept nothing,
	 * whose schema is the boolean {@code false}
	 */
	default Map<String, Object> toSchema() {
		return schema().toMap();
	}

	/**
	 * @return {@code value}
	 * @throws ValidationFailure if {@code value} doesn't conform to {@link #schema()}
	 */
	default @Nullable Object validate(@Nullable Object value) {
		return SchemaValidator.validate(schema(), value);
	}

	default boolean accepts(@Nullable Object value) {
		return SchemaValidator.accepts(schema(), value);
	}
}
