package works.wtypes.jackson;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;
import works.wtypes.TypeDescriptor;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.schema.SchemaNode;

/**
 * Converts schema documents to and from JSON text.
 */
public final class SchemaJson {
	private SchemaJson() {}

	private static final ObjectMapper MAPPER = JsonMapper.builder()
		.enable(SerializationFeature.INDENT_OUTPUT)
		.build();

	public static String write(TypeDescriptor type) {
		return write(type.schema());
	}

	public static String write(SchemaNode node) {
		return MAPPER.writeValueAsString(node.render());
	}

	/**
	 * @throws DefinitionError if {@code json} isn't a schema document this library supports
	 * @throws JacksonException if {@code json} isn't valid JSON
	 */
	public static SchemaNode read(String json) {
		return SchemaNode.fromJson(MAPPER.readValue(json, Object.class));
	}
}
