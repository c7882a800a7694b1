package works.wtypes.events;

@FunctionalInterface
public interface ChangeListener {
	void onChange(Change change);
}
