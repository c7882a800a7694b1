package works.wtypes.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a configuration file into a nested mapping of plain Java values:
 * {@link Map}s, {@link java.util.List}s, strings, numbers, booleans and nulls.
 */
@FunctionalInterface
public interface ConfigSource {
	Map<String, Object> read(Path path) throws IOException;
}
