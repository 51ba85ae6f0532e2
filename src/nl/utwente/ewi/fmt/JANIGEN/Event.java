package nl.utwente.ewi.fmt.JANIGEN;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;

/**
 * A named message exchanged between automata, with the automata that
 * send and receive it and the fields it carries.
 */
public class Event
{
	public static final String SEND_SUFFIX = "_on_send";
	public static final String RECEIVE_SUFFIX = "_on_receive";

	/** How the synchronizer treats an event. */
	public enum Classification {
		SYNCHRONIZE,
		/** Handled elsewhere, e.g. by the global timer. */
		SKIP,
		/** Never sent: the edges receiving it can never be taken. */
		SKIP_AND_REMOVE_RECEIVERS
	}

	public final String name;
	private final LinkedHashMap<String, JaniType> payload = new LinkedHashMap<>();
	private boolean hasPayload;
	/* Maps automaton names to their sending/receiving action. */
	private final LinkedHashMap<String, String> senders = new LinkedHashMap<>();
	private final LinkedHashMap<String, String> receivers = new LinkedHashMap<>();
	private boolean frozen;

	public Event(String name)
	{
		if (name == null || name.isEmpty())
			throw new InvalidModelException("Events need a name");
		this.name = name;
	}

	public static String sendAction(String event) {
		return event + SEND_SUFFIX;
	}

	public static String receiveAction(String event) {
		return event + RECEIVE_SUFFIX;
	}

	public String getSendAction() {
		return sendAction(name);
	}

	public String getReceiveAction() {
		return receiveAction(name);
	}

	private void checkMutable() {
		if (frozen)
			throw new IllegalStateException("Event '" + name + "' can no longer be changed");
	}

	private void addEndpoint(Map<String, String> endpoints, String role,
	                         String automaton, String action)
	{
		checkMutable();
		String prev = endpoints.get(automaton);
		if (prev != null && !prev.equals(action))
			throw new InvalidModelException("Automaton '" + automaton + "' " + role + " event '" + name + "' with both '" + prev + "' and '" + action + "'");
		endpoints.put(automaton, action);
	}

	public void addSender(String automaton, String action) {
		addEndpoint(senders, "sends", automaton, action);
	}

	public void addReceiver(String automaton, String action) {
		addEndpoint(receivers, "receives", automaton, action);
	}

	/** Sending automata and the action they send with. */
	public Map<String, String> getSenders() {
		return Collections.unmodifiableMap(senders);
	}

	public Map<String, String> getReceivers() {
		return Collections.unmodifiableMap(receivers);
	}

	/**
	 * Declare the fields carried by the event. Every declaration of
	 * the same event must agree.
	 */
	public void setPayload(Map<String, JaniType> fields) {
		checkMutable();
		if (hasPayload) {
			if (!payload.equals(fields))
				throw new InvalidModelException("Conflicting payloads for event '" + name + "': " + payload + " and " + fields);
			return;
		}
		payload.putAll(fields);
		hasPayload = true;
	}

	public Map<String, JaniType> getPayload() {
		return Collections.unmodifiableMap(payload);
	}

	void freeze() {
		frozen = true;
	}

	public boolean isTimerEvent() {
		return name.startsWith(InterfaceKind.TIMER.eventPrefix);
	}

	public Classification classify() {
		if (isTimerEvent())
			return Classification.SKIP;
		if (senders.isEmpty() && InterfaceKind.isAnyOptionalEvent(name))
			return Classification.SKIP_AND_REMOVE_RECEIVERS;
		return Classification.SYNCHRONIZE;
	}

	public String toString() {
		return "Event " + name + " (senders " + senders.keySet() + ", receivers " + receivers.keySet() + ")";
	}
}
