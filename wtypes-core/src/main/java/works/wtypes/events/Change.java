package works.wtypes.events;

import org.jetbrains.annotations.Nullable;

/**
 * A committed change to one field of an {@link EventedRecord}.
 *
 * @param oldValue null if the field was absent
 * @param newValue null if the field was removed
 */
public record Change(EventedRecord source, String name, @Nullable Object oldValue, @Nullable Object newValue) { }
