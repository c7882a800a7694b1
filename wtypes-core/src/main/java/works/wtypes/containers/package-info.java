/**
 * Live {@link java.util.Map} and {@link java.util.List} implementations bound to a
 * {@link works.wtypes.TypeDescriptor}, which validate every mutation before committing it.
 */
package works.wtypes.containers;
