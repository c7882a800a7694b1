/**
 * Jackson-based I/O for wtypes: {@link works.wtypes.jackson.JacksonConfigSource} reads JSON and YAML
 * configuration files for {@link works.wtypes.config.ConfigBinder}, and
 * {@link works.wtypes.jackson.SchemaJson} converts schema documents to and from JSON text.
 */
package works.wtypes.jackson;
