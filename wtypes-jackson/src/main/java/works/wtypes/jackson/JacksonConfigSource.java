package works.wtypes.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;
import works.wtypes.config.ConfigSource;

import static java.util.Objects.requireNonNull;

/**
 * Reads JSON ({@code .json}) and YAML ({@code .yaml}, {@code .yml}) configuration files,
 * choosing the format by file extension.
 */
public class JacksonConfigSource implements ConfigSource {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public JacksonConfigSource() {
		this(JsonMapper.builder().build(), YAMLMapper.builder().build());
	}

	public JacksonConfigSource(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
		this.jsonMapper = requireNonNull(jsonMapper);
		this.yamlMapper = requireNonNull(yamlMapper);
	}

	/**
	 * @throws IllegalArgumentException if the file extension isn't one of the supported ones
	 * @throws IOException if the file can't be read or parsed, or doesn't contain an object
	 */
	@Override
	public Map<String, Object> read(Path path) throws IOException {
		ObjectMapper mapper = mapperFor(path);
		Map<String, Object> result;
		try (InputStream in = Files.newInputStream(path)) {
			result = mapper.readValue(in, MAP_TYPE);
		} catch (JacksonException e) {
			throw new IOException("Unable to parse " + path + ": " + e.getOriginalMessage(), e);
		}
		if (result == null) {
			throw new IOException("Configuration file must contain an object: " + path);
		}
		LOGGER.debug("Read {} top-level field{} from {}", result.size(), (result.size() == 1) ? "" : "s", path);
		return result;
	}

	private ObjectMapper mapperFor(Path path) {
		String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		if (name.endsWith(".json")) {
			return jsonMapper;
		} else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
			return yamlMapper;
		} else {
			throw new IllegalArgumentException("Unsupported configuration file type: " + path);
		}
	}

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonConfigSource.class);
}
