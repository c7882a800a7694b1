/**
 * Records that propagate field values to other containers through {@link works.wtypes.events.Link}s
 * and report committed changes to {@link works.wtypes.events.ChangeListener}s.
 */
package works.wtypes.events;
