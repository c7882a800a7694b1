/**
 * Type descriptors, rooted at {@link works.wtypes.TypeDescriptor}, and the
 * {@link works.wtypes.Types} factory that builds and combines them.
 */
package works.wtypes;
