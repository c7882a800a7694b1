package works.wtypes.schema;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Value of the {@link Keyword#ITEMS items} keyword.
 */
public sealed interface Items {
	/**
	 * @return the schema for the item at {@code index},
	 * or {@link SchemaNode#ANY} if the items keyword doesn't constrain that position.
	 */
	SchemaNode schemaAt(int index);

	/**
	 * Rendered form for {@link SchemaNode#toMap()}.
	 */
	Object render();

	/**
	 * Every item must conform to {@code schema}.
	 */
	record Uniform(SchemaNode schema) implements Items {
		public Uniform {
			requireNonNull(schema);
		}

		@Override
		public SchemaNode schemaAt(int index) {
			return schema;
		}

		@Override
		public Object render() {
			return schema.render();
		}
	}

	/**
	 * Tuple mode: the item at position {@code i} must conform to {@code schemas[i]}.
	 * Items beyond the last slot are unconstrained here; tuple types bound
	 * the length with {@link Keyword#MAX_ITEMS maxItems}.
	 */
	record Positional(List<SchemaNode> schemas) implements Items {
		public Positional {
			schemas = List.copyOf(schemas);
		}

		@Override
		public SchemaNode schemaAt(int index) {
			return (index < schemas.size()) ? schemas.get(index) : SchemaNode.ANY;
		}

		@Override
		public Object render() {
			List<Object> result = new ArrayList<>(schemas.size());
			schemas.forEach(s -> result.add(s.render()));
			return result;
		}
	}
}
