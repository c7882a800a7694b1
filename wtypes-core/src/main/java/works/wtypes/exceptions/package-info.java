/**
 * The unchecked exceptions thrown by this library, rooted at {@link works.wtypes.exceptions.WtypesException}.
 */
package works.wtypes.exceptions;
