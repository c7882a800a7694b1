package works.wtypes.events;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wtypes.TypeDescriptor;
import works.wtypes.containers.DictContainer;
import works.wtypes.containers.RecordContainer;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.Values;

import static java.util.Objects.requireNonNull;

/**
 * A {@link RecordContainer} that can push its field values to other containers
 * and notify listeners of changes.
 * <p>
 * A write to a linked field is all-or-nothing across every container involved:
 * each target's own validation is run before anything is committed, and if any target
 * would reject its new value, the write throws that {@link ValidationFailure} and no container changes.
 * Otherwise the local field is committed first, then the targets are written.
 * A link from one field of a record to another field of the same record is applied
 * together with the local write, as a single change.
 * <p>
 * Propagation goes one hop: the writes made to targets do not trigger the targets' own links.
 * A target that already holds an equal value is skipped entirely.
 * Together these mean two records linked to each other settle after a single write.
 * Any other write to a target, including one made by an observer reacting to a propagated change,
 * triggers that target's links as usual.
 */
public class EventedRecord extends RecordContainer {
	private final List<Link> links = new ArrayList<>();
	private final Map<String, List<ChangeListener>> observers = new LinkedHashMap<>();

	public EventedRecord(TypeDescriptor type) {
		super(type);
	}

	public EventedRecord(TypeDescriptor type, @Nullable Map<String, ?> seed) {
		super(type, seed);
	}

	public static EventedRecord from(TypeDescriptor type, @Nullable Object seed) {
		return new EventedRecord(type, requireObject(type, seed));
	}

	/**
	 * Registers a one-way link: subsequent writes to {@code localKey} are also written to
	 * {@code otherKey} of {@code other}.
	 * Registering the same connection again replaces the earlier link.
	 */
	public Link dlink(String localKey, DictContainer other, String otherKey) {
		return dlink(localKey, other, otherKey, UnaryOperator.identity());
	}

	/**
	 * @param transform computes the value written to {@code otherKey} from the value written to {@code localKey}
	 */
	public Link dlink(String localKey, DictContainer other, String otherKey, UnaryOperator<Object> transform) {
		Link link = new Link(localKey, other, otherKey, transform);
		for (int i = 0; i < links.size(); i++) {
			if (links.get(i).connects(localKey, other, otherKey)) {
				links.set(i, link);
				LOGGER.debug("Relinked {}", link);
				return link;
			}
		}
		links.add(link);
		LOGGER.debug("Linked {}", link);
		return link;
	}

	/**
	 * Links {@code localKey} to {@code otherKey} of {@code other}
	 * and, if {@code other} is also an {@link EventedRecord}, {@code otherKey} back to {@code localKey}.
	 */
	public void link(String localKey, DictContainer other, String otherKey) {
		dlink(localKey, other, otherKey);
		if (other instanceof EventedRecord evented && !(other == this && otherKey.equals(localKey))) {
			evented.dlink(otherKey, this, localKey);
		}
	}

	/**
	 * Removes the one-way link from {@code localKey} to {@code otherKey} of {@code other}, if any.
	 *
	 * @return true if a link was removed
	 */
	public boolean unlink(String localKey, DictContainer other, String otherKey) {
		boolean removed = links.removeIf(link -> link.connects(localKey, other, otherKey));
		if (removed) {
			LOGGER.debug("Unlinked {} -> {}", localKey, otherKey);
		}
		return removed;
	}

	public List<Link> links() {
		return Collections.unmodifiableList(links);
	}

	/**
	 * Calls {@code listener} after each committed change to the field {@code key},
	 * whether written directly, by propagation from a link, or removed.
	 */
	public void observe(String key, ChangeListener listener) {
		observers.computeIfAbsent(requireNonNull(key), k -> new ArrayList<>()).add(requireNonNull(listener));
	}

	public boolean unobserve(String key, ChangeListener listener) {
		List<ChangeListener> listeners = observers.get(key);
		return listeners != null && listeners.remove(listener);
	}

	@Override
	protected Object setField(String key, @Nullable Object value) {
		Map<String, Object> update = new LinkedHashMap<>();
		update.put(key, value);
		Object prior = get(key);
		write(update);
		return prior;
	}

	@Override
	public void putAll(Map<? extends String, ?> updates) {
		write(updates);
	}

	private void write(Map<? extends String, ?> updates) {
		Map<String, Object> local = frozenCopy(updates);
		List<PlannedWrite> plan = plan(local);
		plan.removeIf(w -> {
			if (w.target() == this) {
				local.putAll(w.fields());
				return true;
			}
			return false;
		});
		checkFields(local);
		for (PlannedWrite w : plan) {
			w.target().checkFields(w.fields());
		}
		commitAll(local);
		for (PlannedWrite w : plan) {
			LOGGER.debug("Propagating {} to {}", w.fields().keySet(), w.target().getClass().getSimpleName());
			if (w.target() instanceof EventedRecord evented) {
				evented.receive(w.fields());
			} else {
				w.target().putAll(w.fields());
			}
		}
	}

	/**
	 * Applies a propagated write without following this record's own links.
	 */
	private void receive(Map<String, Object> fields) {
		checkFields(fields);
		commitAll(fields);
	}

	/**
	 * @return the writes the links call for, grouped by target, omitting those the target already holds
	 */
	private List<PlannedWrite> plan(Map<? extends String, ?> updates) {
		List<PlannedWrite> result = new ArrayList<>();
		for (Link link : links) {
			if (!updates.containsKey(link.sourceKey())) {
				continue;
			}
			Object propagated = Values.freeze(link.transform().apply(updates.get(link.sourceKey())));
			DictContainer target = link.target();
			if (target.containsKey(link.targetKey()) && Values.jsonEquals(target.get(link.targetKey()), propagated)) {
				continue;
			}
			writeFor(result, target).fields().put(link.targetKey(), propagated);
		}
		return result;
	}

	private static PlannedWrite writeFor(List<PlannedWrite> plan, DictContainer target) {
		for (PlannedWrite w : plan) {
			if (w.target() == target) {
				return w;
			}
		}
		PlannedWrite result = new PlannedWrite(target, new LinkedHashMap<>());
		plan.add(result);
		return result;
	}

	private record PlannedWrite(DictContainer target, Map<String, Object> fields) { }

	@Override
	protected void afterChange(String key, @Nullable Object oldValue, @Nullable Object newValue) {
		List<ChangeListener> listeners = observers.get(key);
		if (listeners == null || Values.jsonEquals(oldValue, newValue)) {
			return;
		}
		Change change = new Change(this, key, oldValue, newValue);
		for (ChangeListener listener : List.copyOf(listeners)) {
			listener.onChange(change);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventedRecord.class);
}
