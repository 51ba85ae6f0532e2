package nl.utwente.ewi.fmt.JANIGEN;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayInfo;

class EventSynchronizerTest
{
	private EventRegistry events;
	private JaniModel model;

	@BeforeEach
	void setUp() {
		events = new EventRegistry();
		model = new JaniModel("events");
	}

	/* An automaton with one self-loop per action, registered as
	 * sender or receiver by the suffix of the action. */
	private Automaton automaton(String name, String... actions) {
		Automaton a = new Automaton(name);
		a.addLocation("l", true);
		for (String action : actions) {
			a.addEdge(new Edge("l", action, "l"));
			if (action.endsWith(Event.SEND_SUFFIX)) {
				String ev = action.substring(0, action.length() - Event.SEND_SUFFIX.length());
				events.getOrCreate(ev).addSender(name, action);
			} else if (action.endsWith(Event.RECEIVE_SUFFIX)) {
				String ev = action.substring(0, action.length() - Event.RECEIVE_SUFFIX.length());
				events.getOrCreate(ev).addReceiver(name, action);
			}
		}
		model.addAutomaton(a);
		return a;
	}

	private List<String> implement(List<PeriodicTimer> timers) {
		return EventSynchronizer.implementEvents(events, timers, model, 10);
	}

	@Test
	void connectsSenderWithAllReceivers() {
		automaton("sensor", "level_on_send");
		automaton("controller", "level_on_receive");
		automaton("logger", "level_on_receive");
		events.getOrCreate("level").setPayload(Map.of("data", JaniType.of(JaniBaseType.INTEGER)));

		assertEquals(List.of(), implement(List.of()));

		Automaton ea = model.getAutomaton("level");
		assertEquals(Set.of(EventSynchronizer.WAITING, EventSynchronizer.RECEIVED), ea.getLocations());
		assertEquals(Set.of("level_on_send", "level_on_receive"), ea.getActions());
		Composition c = model.getComposition();
		assertEquals(List.of("sensor", "controller", "logger", "level"), c.getElements());
		assertEquals(Map.of("sensor", "level_on_send", "level", "level_on_send"),
		             c.getParticipants("level_on_send"));
		assertEquals(Map.of("controller", "level_on_receive", "logger", "level_on_receive", "level", "level_on_receive"),
		             c.getParticipants("level_on_receive"));
		for (Composition.Sync s : c.getSyncs())
			assertEquals(c.getElements().size(), s.vector.size());

		assertEquals(JaniType.of(JaniBaseType.INTEGER), model.getVariable("level.data").type);
		JaniVariable valid = model.getVariable("level" + EventSynchronizer.VALID_SUFFIX);
		assertEquals(false, valid.initial.evaluate(Map.of()));
	}

	@Test
	void givesArrayFieldsTheMaximumSize() {
		automaton("sensor", "scan_on_send");
		automaton("controller", "scan_on_receive");
		events.getOrCreate("scan").setPayload(Map.of("ranges", JaniType.array(JaniBaseType.REAL, 1)));
		implement(List.of());

		JaniType t = model.getVariable("scan.ranges").type;
		assertEquals(new ArrayInfo(JaniBaseType.REAL, 10), t.shape);
		assertEquals(0L, model.getVariable("scan.ranges" + JaniModel.LENGTH_SUFFIX).initial.evaluate(Map.of()));
	}

	@Test
	void reportsEventsNobodyReceives() {
		automaton("talker", "chatter_on_send");
		assertEquals(List.of("chatter"), implement(List.of()));
		Automaton ea = model.getAutomaton("chatter");
		assertEquals(Set.of(EventSynchronizer.WAITING), ea.getLocations());
		assertEquals(Map.of("talker", "chatter_on_send", "chatter", "chatter_on_send"),
		             model.getComposition().getParticipants("chatter_on_send"));
	}

	@Test
	void requiresASender() {
		automaton("listener", "topic_scan_on_receive");
		InvalidModelException e = assertThrows(InvalidModelException.class, () -> implement(List.of()));
		assertTrue(e.getMessage().contains("topic_scan"));
	}

	@Test
	void dropsReceiversOfOptionalEventsWithoutSender() {
		automaton("client", "action_move_feedback_on_receive", "action_move_goal_on_send");
		automaton("server", "action_move_goal_on_receive");
		implement(List.of());

		assertNull(model.getAutomaton("action_move_feedback"));
		assertEquals(Set.of("action_move_goal_on_send"), model.getAutomaton("client").getActions());
		assertTrue(model.getComposition().hasSync("action_move_goal_on_receive"));
	}

	@Test
	void rejectsMismatchedActions() {
		automaton("sensor", "renamed");
		events.getOrCreate("level").addSender("sensor", "renamed");
		assertThrows(InvalidModelException.class, () -> implement(List.of()));
	}

	@Test
	void freezesTheRegistry() {
		automaton("sensor", "level_on_send");
		implement(List.of());
		assertTrue(events.isFrozen());
		assertThrows(IllegalStateException.class, () -> events.getOrCreate("late"));
		assertThrows(IllegalStateException.class, () -> events.get("level").addReceiver("x", "level_on_receive"));
	}

	@Test
	void letsTimeAdvanceOnlyWhenEventsAreWaiting() {
		List<PeriodicTimer> timers = List.of(new PeriodicTimer("ctrl", 10));
		model.addAutomaton(GlobalTimer.makeAutomaton(timers, ConversionOptions.DEFAULT_MAX_TIME_NS));
		automaton("controller", "ros_time_rate.ctrl_on_receive", "cmd_on_send");
		automaton("motor", "cmd_on_receive");
		implement(timers);

		assertNull(model.getAutomaton("ros_time_rate.ctrl"));
		assertTrue(model.getAutomaton("cmd").getActions().contains(GlobalTimer.ENABLE_ACTION));
		Composition c = model.getComposition();
		assertEquals(Map.of("cmd", GlobalTimer.ENABLE_ACTION, GlobalTimer.AUTOMATON_NAME, GlobalTimer.TICK_ACTION),
		             c.getParticipants(GlobalTimer.TICK_ACTION));
		assertEquals(Map.of("cmd", GlobalTimer.ENABLE_ACTION,
		                    GlobalTimer.AUTOMATON_NAME, "ros_time_rate.ctrl_on_receive",
		                    "controller", "ros_time_rate.ctrl_on_receive"),
		             c.getParticipants("ros_time_rate.ctrl_on_receive"));
	}

	@Test
	void addsNothingWhenRunAgainOnTimerEvents() {
		List<PeriodicTimer> timers = List.of(new PeriodicTimer("ctrl", 10));
		model.addAutomaton(GlobalTimer.makeAutomaton(timers, ConversionOptions.DEFAULT_MAX_TIME_NS));
		automaton("controller", "ros_time_rate.ctrl_on_receive");
		implement(timers);
		int automata = model.getAutomata().size();
		int syncs = model.getComposition().getSyncs().size();

		implement(timers);
		assertEquals(automata, model.getAutomata().size());
		assertEquals(syncs, model.getComposition().getSyncs().size());
		assertEquals(2, syncs);
	}

	@Test
	void requiresOneReceiverPerTimer() {
		List<PeriodicTimer> timers = List.of(new PeriodicTimer("ctrl", 10));
		model.addAutomaton(GlobalTimer.makeAutomaton(timers, ConversionOptions.DEFAULT_MAX_TIME_NS));
		automaton("a", "ros_time_rate.ctrl_on_receive");
		automaton("b", "ros_time_rate.ctrl_on_receive");
		assertThrows(ConfigurationException.class, () -> implement(timers));
	}

	@Test
	void requiresTheGlobalTimerForTimers() {
		automaton("a", "ros_time_rate.ctrl_on_receive");
		assertThrows(ConfigurationException.class, () -> implement(List.of(new PeriodicTimer("ctrl", 10))));
	}

	@Test
	void rejectsUnusedTimers() {
		List<PeriodicTimer> timers = List.of(new PeriodicTimer("ctrl", 10));
		model.addAutomaton(GlobalTimer.makeAutomaton(timers, ConversionOptions.DEFAULT_MAX_TIME_NS));
		automaton("a", "other_on_send");
		assertThrows(ConfigurationException.class, () -> implement(timers));
	}

	@Test
	void rejectsInvalidArraySize() {
		assertThrows(ConfigurationException.class,
				() -> EventSynchronizer.implementEvents(events, List.of(), model, 0));
	}
}
