package works.wtypes;

import java.util.List;
import java.util.Map;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.Formats;
import works.wtypes.schema.JsonType;

/**
 * Predefined descriptors and the factories that combine them.
 * <p>
 * Every factory that combines descriptors synthesizes the result's schema immediately,
 * so a combination that can't be expressed throws {@link DefinitionError}
 * where it's declared rather than where it's first used.
 */
public final class Types {
	private Types() {}

	public static final AnyType ANY = new AnyType();
	public static final NeverType NEVER = new NeverType();

	/**
	 * Any {@link Number} without a fractional part.
	 */
	public static final ScalarType INTEGER = new ScalarType(JsonType.INTEGER);

	/**
	 * Any {@link Number}.
	 */
	public static final ScalarType NUMBER = new ScalarType(JsonType.NUMBER);
	public static final ScalarType FLOAT = NUMBER;
	public static final ScalarType STRING = new ScalarType(JsonType.STRING);
	public static final ScalarType BOOLEAN = new ScalarType(JsonType.BOOLEAN);
	public static final ScalarType NULL = new ScalarType(JsonType.NULL);

	/**
	 * Any mapping.
	 */
	public static final ObjectType DICT = new ObjectType(Shape.EMPTY);

	/**
	 * Any list.
	 */
	public static final ArrayType LIST = new ArrayType(ANY);

	public static final RefinedType DATE_TIME = formatted(Formats.DATE_TIME);
	public static final RefinedType DATE = formatted(Formats.DATE);
	public static final RefinedType TIME = formatted(Formats.TIME);
	public static final RefinedType EMAIL = formatted(Formats.EMAIL);
	public static final RefinedType HOSTNAME = formatted(Formats.HOSTNAME);
	public static final RefinedType IPV4 = formatted(Formats.IPV4);
	public static final RefinedType IPV6 = formatted(Formats.IPV6);
	public static final RefinedType URI = formatted(Formats.URI_FORMAT);
	public static final RefinedType UUID = formatted(Formats.UUID);
	public static final RefinedType REGEX = formatted(Formats.REGEX);

	private static RefinedType formatted(String format) {
		return new RefinedType(STRING, List.of(Constraint.format(format)));
	}

	public static InstanceOfType instanceOf(Class<?> javaClass) {
		return new InstanceOfType(javaClass);
	}

	public static ObjectType dict(Shape shape) {
		return declared(new ObjectType(shape));
	}

	/**
	 * @return an object type constraining the given fields if they're present,
	 * and allowing any other fields. Unlike a {@link Shape}, none of the fields is required.
	 */
	public static RefinedType dict(Map<String, ? extends TypeDescriptor> fields) {
		return refine(DICT, Constraint.properties(fields));
	}

	/**
	 * @return an object type with no declared fields whose values must each
	 * conform to one of the {@code valueTypes}
	 */
	public static ObjectType dictOf(TypeDescriptor... valueTypes) {
		return dict(Shape.builder().additionalProperties(unionOrSingle(valueTypes)).build());
	}

	public static ArrayType list() {
		return LIST;
	}

	public static ArrayType list(TypeDescriptor itemType) {
		return declared(new ArrayType(itemType));
	}

	/**
	 * @return a list type whose items may each be any of the given types
	 */
	public static ArrayType list(TypeDescriptor first, TypeDescriptor second, TypeDescriptor... rest) {
		TypeDescriptor[] all = new TypeDescriptor[rest.length + 2];
		all[0] = first;
		all[1] = second;
		System.arraycopy(rest, 0, all, 2, rest.length);
		return list(union(all));
	}

	public static RefinedType uniqueList(TypeDescriptor itemType) {
		return refine(list(itemType), Constraint.uniqueItems(true));
	}

	/**
	 * @return a fixed-length list type whose item at each position conforms to the type at that position
	 */
	public static TupleType tuple(TypeDescriptor... itemTypes) {
		return declared(new TupleType(List.of(itemTypes)));
	}

	/**
	 * @return a type accepting any value that at least one of the {@code operands} accepts
	 * @throws DefinitionError if there are no operands
	 */
	public static UnionType union(TypeDescriptor... operands) {
		return union(List.of(operands));
	}

	public static UnionType union(List<? extends TypeDescriptor> operands) {
		return declared(new UnionType(List.copyOf(operands)));
	}

	/**
	 * @return a type accepting only values that every one of the {@code operands} accepts
	 * @throws DefinitionError if there are no operands
	 */
	public static IntersectionType allOf(TypeDescriptor... operands) {
		return allOf(List.of(operands));
	}

	public static IntersectionType allOf(List<? extends TypeDescriptor> operands) {
		return declared(new IntersectionType(List.copyOf(operands)));
	}

	/**
	 * @return a type accepting values that exactly one of the {@code operands} accepts
	 * @throws DefinitionError if there are no operands
	 */
	public static ExclusiveUnionType oneOf(TypeDescriptor... operands) {
		return oneOf(List.of(operands));
	}

	public static ExclusiveUnionType oneOf(List<? extends TypeDescriptor> operands) {
		return declared(new ExclusiveUnionType(List.copyOf(operands)));
	}

	/**
	 * @return a type accepting exactly the values {@code operand} rejects
	 */
	public static ComplementType not(TypeDescriptor operand) {
		return declared(new ComplementType(operand));
	}

	/**
	 * @return a type accepting the values {@code base} accepts that also satisfy all the {@code constraints}
	 * @throws DefinitionError if the constraints can't apply to the values of {@code base},
	 * like {@code minLength} on an integer
	 */
	public static RefinedType refine(TypeDescriptor base, Constraint... constraints) {
		return refine(base, List.of(constraints));
	}

	public static RefinedType refine(TypeDescriptor base, List<Constraint> constraints) {
		return declared(new RefinedType(base, constraints));
	}

	private static TypeDescriptor unionOrSingle(TypeDescriptor... types) {
		if (types.length == 1) {
			return types[0];
		} else {
			return union(types);
		}
	}

	private static <T extends TypeDescriptor> T declared(T type) {
		type.schema();
		return type;
	}
}
