package works.wtypes.jackson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.wtypes.ObjectType;
import works.wtypes.Shape;
import works.wtypes.Types;
import works.wtypes.config.ConfigBinder;
import works.wtypes.containers.RecordContainer;
import works.wtypes.exceptions.ValidationFailure;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JacksonConfigSourceTest {
	static final ObjectType SERVER = Types.dict(Shape.builder()
		.field("host", Types.STRING)
		.field("port", Types.INTEGER, 8080)
		.field("aliases", Types.list(Types.HOSTNAME), List.of())
		.build());

	static final ObjectType APP = Types.dict(Shape.builder()
		.field("server", SERVER)
		.field("debug", Types.BOOLEAN, false)
		.additionalProperties(false)
		.build());

	final JacksonConfigSource source = new JacksonConfigSource();

	@TempDir
	Path dir;

	@Test
	void readsJson() throws IOException {
		Path file = write("app.json", "{ \"server\": { \"host\": \"example.com\", \"port\": 443 }, \"debug\": true }");
		assertEquals(Map.of("server", Map.of("host", "example.com", "port", 443), "debug", true), source.read(file));
	}

	@Test
	void readsYaml() throws IOException {
		Path file = write("app.yml", "server:\n  host: example.com\n  aliases:\n    - www.example.com\n");
		assertEquals(Map.of("server", Map.of("host", "example.com", "aliases", List.of("www.example.com"))), source.read(file));
	}

	@Test
	void unsupportedExtension_throws() throws IOException {
		Path file = write("app.toml", "debug = true");
		assertThrows(IllegalArgumentException.class, () -> source.read(file));
	}

	@Test
	void nonObjectRoot_isAnIOException() throws IOException {
		Path file = write("app.json", "[1, 2]");
		IOException e = assertThrows(IOException.class, () -> source.read(file));
		assertThat(e.getMessage(), containsString("app.json"));
	}

	@Test
	void malformedFile_isAnIOException() throws IOException {
		Path file = write("app.json", "{ \"server\": ");
		assertThrows(IOException.class, () -> source.read(file));
	}

	@Test
	void missingFile_isAnIOException() {
		assertThrows(IOException.class, () -> source.read(dir.resolve("absent.yaml")));
	}

	@Test
	void loadsLayeredFiles() throws IOException {
		Path base = write("base.yaml", "server:\n  host: localhost\n  port: 80\n");
		Path override = write("override.json", "{ \"server\": { \"port\": 8443 }, \"debug\": true }");
		RecordContainer config = new ConfigBinder(source).load(APP, base, override);
		assertEquals(Map.of("host", "localhost", "port", 8443), config.attr("server"));
		assertEquals(true, config.attr("debug"));
	}

	@Test
	void wrongKindInFile_namesThePath() throws IOException {
		Path base = write("base.yaml", "server:\n  host: localhost\n  port: eighty\n");
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> new ConfigBinder(source).load(APP, base));
		assertEquals("$.server.port", e.path().toString());
	}

	@Test
	void unknownTopLevelKey_isRejected() throws IOException {
		Path base = write("base.yaml", "server:\n  host: localhost\nverbose: true\n");
		ValidationFailure e = assertThrows(ValidationFailure.class, () -> new ConfigBinder(source).load(APP, base));
		assertEquals("$.verbose", e.path().toString());
	}

	private Path write(String name, String contents) throws IOException {
		return Files.writeString(dir.resolve(name), contents);
	}
}
