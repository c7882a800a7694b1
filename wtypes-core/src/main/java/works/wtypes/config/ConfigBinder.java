package works.wtypes.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.TypeDescriptor;
import works.wtypes.containers.RecordContainer;
import works.wtypes.exceptions.ValidationFailure;

/**
 * Builds and updates {@link RecordContainer}s from configuration mappings.
 * <p>
 * When several mappings are combined, later ones win, and nested mappings are merged
 * recursively rather than replaced. Values are validated against the record's type,
 * so a value of the wrong kind is reported as a {@link ValidationFailure}
 * naming its path, like {@code $.server.port}.
 */
@RequiredArgsConstructor
public class ConfigBinder {
	private final ConfigSource source;

	/**
	 * @throws ValidationFailure if {@code config} doesn't conform to {@code type}
	 */
	public static RecordContainer bind(TypeDescriptor type, Map<String, ?> config) {
		return new RecordContainer(type, config);
	}

	/**
	 * Reads each of the {@code paths} in order, merges them, and binds the result.
	 */
	public RecordContainer load(TypeDescriptor type, Path... paths) throws IOException {
		RecordContainer result = bind(type, readAll(List.of(paths)));
		LOGGER.info("Loaded {} field{} from {}", result.size(), (result.size() == 1) ? "" : "s", List.of(paths));
		return result;
	}

	/**
	 * Reads each of the {@code paths} in order and merges them into {@code container}.
	 */
	public void update(RecordContainer container, Path... paths) throws IOException {
		update(container, readAll(List.of(paths)));
		LOGGER.info("Updated configuration from {}", List.of(paths));
	}

	/**
	 * Merges {@code config} into the current contents of {@code container}.
	 * The top-level fields are replaced together: if any is invalid, none changes.
	 */
	public static void update(RecordContainer container, Map<String, ?> config) {
		Map<String, Object> updates = new LinkedHashMap<>();
		config.forEach((key, value) -> updates.put(key, mergedValue(container.get(key), value)));
		container.putAll(updates);
	}

	private Map<String, Object> readAll(List<Path> paths) throws IOException {
		Map<String, Object> result = new LinkedHashMap<>();
		for (Path path : paths) {
			LOGGER.debug("Reading {}", path);
			deepMerge(result, source.read(path));
		}
		return result;
	}

	/**
	 * Merges {@code overlay} into {@code base} in place.
	 */
	static void deepMerge(Map<String, Object> base, Map<String, ?> overlay) {
		overlay.forEach((key, value) -> base.put(key, mergedValue(base.get(key), value)));
	}

	@SuppressWarnings("unchecked")
	private static Object mergedValue(Object existing, Object overlay) {
		if (existing instanceof Map<?, ?> existingMap && overlay instanceof Map<?, ?> overlayMap) {
			Map<String, Object> result = new LinkedHashMap<>((Map<String, Object>) existingMap);
			deepMerge(result, (Map<String, ?>) overlayMap);
			return result;
		}
		return overlay;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigBinder.class);
}
