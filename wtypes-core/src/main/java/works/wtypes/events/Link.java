package works.wtypes.events;

import java.util.function.UnaryOperator;
import works.wtypes.containers.DictContainer;

import static java.util.Objects.requireNonNull;

/**
 * A one-way subscription: writes to {@code sourceKey} are copied,
 * after applying {@code transform}, to {@code targetKey} of {@code target}.
 * <p>
 * Links compare their targets by identity.
 */
public record Link(String sourceKey, DictContainer target, String targetKey, UnaryOperator<Object> transform) {
	public Link {
		requireNonNull(sourceKey);
		requireNonNull(target);
		requireNonNull(targetKey);
		requireNonNull(transform);
	}

	public boolean connects(String sourceKey, DictContainer target, String targetKey) {
		return this.sourceKey.equals(sourceKey)
			&& this.target == target
			&& this.targetKey.equals(targetKey);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Link other
			&& other.connects(sourceKey, target, targetKey)
			&& other.transform.equals(transform);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * sourceKey.hashCode() + System.identityHashCode(target)) + targetKey.hashCode();
	}

	@Override
	public String toString() {
		return sourceKey + " -> " + target.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(target)) + "." + targetKey;
	}
}
