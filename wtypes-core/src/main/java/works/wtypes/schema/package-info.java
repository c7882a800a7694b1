/**
 * The schema document, rooted at {@link works.wtypes.schema.SchemaNode},
 * and the {@link works.wtypes.schema.SchemaValidator validator} that checks plain Java values against it.
 * <p>
 * Values are interpreted as JSON: {@link java.util.Map}s are objects,
 * {@link java.util.List}s are arrays, and so on. See {@link works.wtypes.schema.JsonType}.
 */
package works.wtypes.schema;
