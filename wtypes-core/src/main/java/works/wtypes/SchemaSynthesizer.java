package works.wtypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.Items;
import works.wtypes.schema.JsonType;
import works.wtypes.schema.Keyword;
import works.wtypes.schema.SchemaNode;

import static works.wtypes.schema.Keyword.ADDITIONAL_PROPERTIES;
import static works.wtypes.schema.Keyword.ALL_OF;
import static works.wtypes.schema.Keyword.ANY_OF;
import static works.wtypes.schema.Keyword.DEFAULT;
import static works.wtypes.schema.Keyword.INSTANCE_OF;
import static works.wtypes.schema.Keyword.ITEMS;
import static works.wtypes.schema.Keyword.MAX_ITEMS;
import static works.wtypes.schema.Keyword.MIN_ITEMS;
import static works.wtypes.schema.Keyword.NOT;
import static works.wtypes.schema.Keyword.ONE_OF;
import static works.wtypes.schema.Keyword.PROPERTIES;
import static works.wtypes.schema.Keyword.REQUIRED;
import static works.wtypes.schema.Keyword.TYPE;

/**
 * Derives the {@link SchemaNode} for a {@link TypeDescriptor}.
 * <p>
 * Results are memoized for the life of the process. Descriptors are immutable values,
 * so computing the same entry twice yields equal nodes and the cache needs no locking.
 */
public final class SchemaSynthesizer {
	private SchemaSynthesizer() {}

	private static final Map<TypeDescriptor, SchemaNode> MEMO = new ConcurrentHashMap<>();

	public static SchemaNode schemaFor(TypeDescriptor type) {
		SchemaNode result = MEMO.get(type);
		if (result == null) {
			// Not computeIfAbsent: synthesis recurses into the operands, which would modify the map during the computation
			result = synthesize(type);
			SchemaNode existing = MEMO.putIfAbsent(type, result);
			if (existing != null) {
				result = existing;
			}
		}
		return result;
	}

	private static SchemaNode synthesize(TypeDescriptor type) {
		LOGGER.debug("Synthesizing schema for {}", type);
		if (type instanceof ScalarType s) {
			return SchemaNode.ofType(s.type());
		} else if (type instanceof AnyType) {
			return SchemaNode.ANY;
		} else if (type instanceof NeverType) {
			return SchemaNode.NOTHING;
		} else if (type instanceof InstanceOfType i) {
			return SchemaNode.of(INSTANCE_OF, i.javaClass());
		} else if (type instanceof ObjectType o) {
			return objectSchema(o.shape());
		} else if (type instanceof ArrayType a) {
			SchemaNode.Builder builder = SchemaNode.builder().put(TYPE, JsonType.ARRAY);
			if (!(a.items() instanceof AnyType)) {
				builder.put(ITEMS, new Items.Uniform(schemaFor(a.items())));
			}
			return builder.build();
		} else if (type instanceof TupleType t) {
			return SchemaNode.builder()
				.put(TYPE, JsonType.ARRAY)
				.put(ITEMS, new Items.Positional(schemasFor(t.items())))
				.put(MIN_ITEMS, t.items().size())
				.put(MAX_ITEMS, t.items().size())
				.build();
		} else if (type instanceof UnionType u) {
			return SchemaNode.of(ANY_OF, schemasFor(u.operands()));
		} else if (type instanceof IntersectionType i) {
			return SchemaNode.of(ALL_OF, schemasFor(i.operands()));
		} else if (type instanceof ExclusiveUnionType x) {
			return SchemaNode.of(ONE_OF, schemasFor(x.operands()));
		} else if (type instanceof ComplementType c) {
			return SchemaNode.of(NOT, schemaFor(c.operand()));
		} else if (type instanceof RefinedType r) {
			List<SchemaNode> overlays = new ArrayList<>(r.constraints().size());
			r.constraints().forEach(c -> overlays.add(schemaFor(c)));
			return schemaFor(r.base()).refine(overlays);
		} else if (type instanceof Constraint c) {
			return constraintNode(c.keyword(), c.value());
		} else {
			throw new AssertionError("Unexpected descriptor: " + type);
		}
	}

	private static SchemaNode objectSchema(Shape shape) {
		Map<String, SchemaNode> properties = new LinkedHashMap<>();
		List<String> required = new ArrayList<>();
		for (Shape.Field field : shape.fields()) {
			SchemaNode fieldSchema = schemaFor(field.type());
			if (field.hasDefault()) {
				try {
					fieldSchema = fieldSchema.refine(SchemaNode.of(DEFAULT, field.defaultValue()));
				} catch (DefinitionError e) {
					throw new DefinitionError("Invalid default for field \"" + field.name() + "\": " + e.getMessage(), e);
				}
			} else {
				required.add(field.name());
			}
			properties.put(field.name(), fieldSchema);
		}
		SchemaNode.Builder builder = SchemaNode.builder().put(TYPE, JsonType.OBJECT);
		if (!properties.isEmpty()) {
			builder.put(PROPERTIES, properties);
		}
		if (!required.isEmpty()) {
			builder.put(REQUIRED, required);
		}
		if (!(shape.additionalProperties() instanceof AnyType)) {
			builder.put(ADDITIONAL_PROPERTIES, schemaFor(shape.additionalProperties()));
		}
		return builder.build();
	}

	/**
	 * @return the node consisting of just the given keyword, with any descriptors
	 * in {@code value} replaced by their schemas
	 * @throws DefinitionError if {@code value} is not valid for {@code keyword}
	 */
	static SchemaNode constraintNode(Keyword keyword, @Nullable Object value) {
		switch (keyword) {
			case ADDITIONAL_PROPERTIES, ITEMS, NOT -> {
				if (value instanceof TypeDescriptor d) {
					return SchemaNode.of(keyword, schemaFor(d));
				} else if (value instanceof List<?> list) {
					return SchemaNode.of(keyword, schemasFor(list));
				}
			}
			case ANY_OF, ALL_OF, ONE_OF -> {
				if (value instanceof List<?> list) {
					return SchemaNode.of(keyword, schemasFor(list));
				}
			}
			case PROPERTIES -> {
				if (value instanceof Map<?, ?> map) {
					Map<Object, Object> result = new LinkedHashMap<>();
					map.forEach((name, d) -> {
						if (!(d instanceof TypeDescriptor td)) {
							throw new DefinitionError("Property \"" + name + "\" needs a type descriptor, not " + d);
						}
						result.put(name, schemaFor(td));
					});
					return SchemaNode.of(keyword, result);
				}
			}
			default -> { }
		}
		return SchemaNode.of(keyword, value);
	}

	private static List<SchemaNode> schemasFor(List<?> descriptors) {
		List<SchemaNode> result = new ArrayList<>(descriptors.size());
		for (Object d : descriptors) {
			if (!(d instanceof TypeDescriptor td)) {
				throw new DefinitionError("Expected a type descriptor, not " + d);
			}
			result.add(schemaFor(td));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaSynthesizer.class);
}
