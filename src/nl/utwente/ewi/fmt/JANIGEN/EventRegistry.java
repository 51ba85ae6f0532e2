package nl.utwente.ewi.fmt.JANIGEN;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

/** All events of a conversion, in order of first reference. */
public class EventRegistry
{
	private final LinkedHashMap<String, Event> events = new LinkedHashMap<>();
	private boolean frozen;

	/** The event with the given name, created if it does not exist. */
	public Event getOrCreate(String name) {
		Event ret = events.get(name);
		if (ret == null) {
			if (frozen)
				throw new IllegalStateException("Cannot add event '" + name + "' after synchronization started");
			ret = new Event(name);
			events.put(name, ret);
		}
		return ret;
	}

	public Event get(String name) {
		return events.get(name);
	}

	public Collection<Event> getEvents() {
		return Collections.unmodifiableCollection(events.values());
	}

	/** Make the registry and all its events read-only. */
	public void freeze() {
		frozen = true;
		for (Event e : events.values())
			e.freeze();
	}

	public boolean isFrozen() {
		return frozen;
	}
}
