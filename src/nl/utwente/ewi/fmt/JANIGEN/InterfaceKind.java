package nl.utwente.ewi.fmt.JANIGEN;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The kinds of communication interface between state machines. Each
 * kind determines how its events are named, which of its events are
 * optional, and how the automata that handle the interface are
 * recognised.
 */
public enum InterfaceKind {
	TOPIC("topic_", null),
	SERVICE("srv_", "srv_handler_"),
	ACTION("action_", "action_handler_",
	       "^action_.*_feedback$",
	       "^action_.*_goal_rejected$"),
	TIMER("ros_time_rate.", null),
	BEHAVIOR_TREE("bt_", null,
	              "^bt_.+_halt$",
	              "^bt_.+_(halt_)?response$");

	public final String eventPrefix;
	/** Name prefix of the automata handling this interface, or null. */
	public final String handlerPrefix;
	/* Events that may legitimately have no sender in a model. */
	private final List<Pattern> optionalEvents;

	InterfaceKind(String eventPrefix, String handlerPrefix, String... optional) {
		this.eventPrefix = eventPrefix;
		this.handlerPrefix = handlerPrefix;
		Pattern[] ps = new Pattern[optional.length];
		for (int i = 0; i < optional.length; i++)
			ps[i] = Pattern.compile(optional[i]);
		this.optionalEvents = List.of(ps);
	}

	/**
	 * The plain name of an event of this interface.
	 *
	 * @param interfaceName Name of the interface instance, e.g. the
	 * topic or timer name.
	 * @param part The message of the interface, e.g. "goal_request",
	 * or null for single-message interfaces.
	 */
	public String eventName(String interfaceName, String part) {
		if (part == null)
			return eventPrefix + interfaceName;
		return eventPrefix + interfaceName + "_" + part;
	}

	public boolean isOptionalEvent(String eventName) {
		for (Pattern p : optionalEvents) {
			if (p.matcher(eventName).matches())
				return true;
		}
		return false;
	}

	/** Whether any interface kind considers this event optional. */
	public static boolean isAnyOptionalEvent(String eventName) {
		for (InterfaceKind k : values()) {
			if (k.isOptionalEvent(eventName))
				return true;
		}
		return false;
	}

	/** Whether the automaton handles the server side of an interface. */
	public static boolean isHandlerAutomaton(String automatonName) {
		for (InterfaceKind k : values()) {
			if (k.handlerPrefix != null && automatonName.startsWith(k.handlerPrefix))
				return true;
		}
		return false;
	}
}
