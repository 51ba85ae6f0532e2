package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayInfo;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;

/**
 * Connects the senders and receivers of every event through a small
 * automaton per event, and builds the composition of the model.
 *
 * An event automaton waits in location {@value #WAITING} until a
 * sender fires {@code <event>_on_send}; if the event has receivers it
 * then moves to {@value #RECEIVED} and returns once the receivers
 * take {@code <event>_on_receive} together.
 *
 * When timers are present, every event automaton also offers
 * {@link GlobalTimer#ENABLE_ACTION} in {@value #WAITING}. Ticks and
 * timer events synchronize with these actions, so time only passes
 * when no event is waiting to be received.
 */
public class EventSynchronizer
{
	private static final Logger LOG = LoggerFactory.getLogger(EventSynchronizer.class);

	public static final String WAITING = "waiting";
	public static final String RECEIVED = "received";
	public static final String VALID_SUFFIX = ".valid";

	private EventSynchronizer() {
	}

	/**
	 * Add the event automata, the event variables and the
	 * composition to the model. The registry is frozen.
	 *
	 * @param events The events referenced by the automata of the
	 * model.
	 * @param timers The timers of the model. If not empty, the model
	 * must contain the {@link GlobalTimer} automaton.
	 * @param maxArraySize Size of array fields of event payloads.
	 * @return The names of the events that nobody receives.
	 */
	public static List<String> implementEvents(EventRegistry events,
	                                           List<PeriodicTimer> timers,
	                                           JaniModel model,
	                                           int maxArraySize)
	{
		if (maxArraySize <= 0)
			throw new ConfigurationException("Maximum array size should be positive, not: " + maxArraySize);
		events.freeze();
		boolean timed = !timers.isEmpty();
		if (timed && model.getAutomaton(GlobalTimer.AUTOMATON_NAME) == null)
			throw new ConfigurationException("Model has timers, but no " + GlobalTimer.AUTOMATON_NAME + " automaton");

		Composition comp = new Composition();
		for (Automaton a : model.getAutomata())
			comp.addElement(a.getName());
		/* Maps event automata to their timer-enable action. */
		LinkedHashMap<String, String> timerEnable = new LinkedHashMap<>();
		ArrayList<String> unreceived = new ArrayList<>();

		for (Event ev : events.getEvents()) {
			switch (ev.classify()) {
			case SKIP:
				LOG.debug("Event '{}' is not synchronized", ev.name);
				continue;
			case SKIP_AND_REMOVE_RECEIVERS:
				int removed = model.removeEdgesWithAction(ev.getReceiveAction());
				LOG.debug("Event '{}' is never sent, removed {} receiving edges", ev.name, removed);
				continue;
			case SYNCHRONIZE:
				break;
			}
			if (ev.getSenders().isEmpty())
				throw new InvalidModelException("Event '" + ev.name + "' must have at least one sender");
			checkActions(ev, ev.getSenders(), ev.getSendAction());
			checkActions(ev, ev.getReceivers(), ev.getReceiveAction());

			Automaton ea = new Automaton(ev.name);
			ea.addLocation(WAITING, true);
			if (timed) {
				ea.addEdge(new Edge(WAITING, GlobalTimer.ENABLE_ACTION, WAITING));
				timerEnable.put(ev.name, GlobalTimer.ENABLE_ACTION);
			}
			boolean received = !ev.getReceivers().isEmpty();
			if (received) {
				ea.addLocation(RECEIVED);
				ea.addEdge(new Edge(WAITING, ev.getSendAction(), RECEIVED));
				ea.addEdge(new Edge(RECEIVED, ev.getReceiveAction(), WAITING));
			} else {
				ea.addEdge(new Edge(WAITING, ev.getSendAction(), WAITING));
				unreceived.add(ev.name);
			}
			model.addAutomaton(ea);
			comp.addElement(ea.getName());

			if (received) {
				LinkedHashMap<String, String> participants = new LinkedHashMap<>(ev.getReceivers());
				participants.put(ea.getName(), ev.getReceiveAction());
				comp.addSync(ev.getReceiveAction(), participants);
			}
			LinkedHashMap<String, String> participants = new LinkedHashMap<>(ev.getSenders());
			participants.put(ea.getName(), ev.getSendAction());
			comp.addSync(ev.getSendAction(), participants);

			addEventVariables(ev, model, maxArraySize);
		}

		if (timed)
			addTimerSyncs(events, timers, comp, timerEnable);
		model.setComposition(comp);
		for (String ev : unreceived)
			LOG.warn("Event '{}' is sent but never received", ev);
		return Collections.unmodifiableList(unreceived);
	}

	private static void checkActions(Event ev, Map<String, String> endpoints, String expected) {
		for (Map.Entry<String, String> e : endpoints.entrySet()) {
			if (!expected.equals(e.getValue()))
				throw new InvalidModelException("Automaton '" + e.getKey() + "' uses action '" + e.getValue() + "' for event '" + ev.name + "', expected '" + expected + "'");
		}
	}

	/** The type of an array field of an event: every dimension has the maximum size. */
	static JaniType payloadType(JaniType field, int maxArraySize) {
		Integer[] sizes = new Integer[field.dimensions];
		for (int i = 0; i < sizes.length; i++)
			sizes[i] = maxArraySize;
		return JaniType.array(new ArrayInfo(field.base, List.of(sizes)));
	}

	private static void addEventVariables(Event ev, JaniModel model, int maxArraySize) {
		for (Map.Entry<String, JaniType> field : ev.getPayload().entrySet()) {
			String var = ev.name + "." + field.getKey();
			JaniType type = field.getValue();
			if (type.isArray()) {
				model.addVariable(new JaniVariable(var, payloadType(type, maxArraySize)));
				model.addVariable(new JaniVariable(var + JaniModel.LENGTH_SUFFIX,
						JaniType.of(JaniBaseType.INTEGER),
						new ConstantExpression(0L), false));
			} else {
				model.addVariable(new JaniVariable(var, type));
			}
		}
		model.addVariable(new JaniVariable(ev.name + VALID_SUFFIX,
				JaniType.of(JaniBaseType.BOOLEAN),
				ConstantExpression.FALSE, false));
	}

	private static void addTimerSyncs(EventRegistry events,
	                                  List<PeriodicTimer> timers,
	                                  Composition comp,
	                                  Map<String, String> timerEnable)
	{
		LinkedHashMap<String, String> tick = new LinkedHashMap<>(timerEnable);
		tick.put(GlobalTimer.AUTOMATON_NAME, GlobalTimer.TICK_ACTION);
		comp.addSync(GlobalTimer.TICK_ACTION, tick);
		for (PeriodicTimer t : timers) {
			Event ev = events.get(t.getEventName());
			if (ev == null || ev.getReceivers().isEmpty())
				throw new ConfigurationException("Timer '" + t.name + "' is not used by any automaton");
			if (ev.getReceivers().size() != 1)
				throw new ConfigurationException("Timer '" + t.name + "' is used by " + ev.getReceivers().size() + " automata, expected one");
			checkActions(ev, ev.getReceivers(), ev.getReceiveAction());
			LinkedHashMap<String, String> participants = new LinkedHashMap<>(timerEnable);
			participants.put(GlobalTimer.AUTOMATON_NAME, ev.getReceiveAction());
			participants.putAll(ev.getReceivers());
			comp.addSync(ev.getReceiveAction(), participants);
		}
	}
}
