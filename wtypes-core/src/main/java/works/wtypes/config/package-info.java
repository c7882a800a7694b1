/**
 * Binds parsed configuration to validated records.
 * File formats are handled by a {@link works.wtypes.config.ConfigSource}.
 */
package works.wtypes.config;
