package nl.utwente.ewi.fmt.JANIGEN;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;

class ConvertTest
{
	private static List<String> automatonNames(JaniModel m) {
		ArrayList<String> ret = new ArrayList<>();
		for (Automaton a : m.getAutomata())
			ret.add(a.getName());
		return ret;
	}

	private static JaniModel batteryModel() {
		StateMachine drainer = new StateMachine("Drainer")
				.addLocation("use_battery", true)
				.addVariable("battery_percent", "int32", "100")
				.declareEventField("level", "data", "int32");
		drainer.addEdge("use_battery", "ros_time_rate.drain_on_receive", null)
				.addDestination("use_battery")
				.assign("battery_percent", "battery_percent - 1");
		drainer.addEdge("use_battery", "level_on_receive", "_event.data < 20")
				.addDestination("use_battery")
				.assign("battery_percent", "100");

		StateMachine manager = new StateMachine("Manager")
				.addLocation("idle", true)
				.addVariable("battery_alarm", "bool", "false")
				.declareEventField("level", "data", "int32");
		manager.addEdge("idle", "level_on_send", "!battery_alarm")
				.addDestination("idle")
				.assign("level.data", "15")
				.assign("battery_alarm", "true");

		return Convert.convert(List.of(drainer, manager),
				List.of(new PeriodicTimer("drain", 1)),
				ConversionOptions.DEFAULT);
	}

	@Test
	void connectsSenderAndReceiverThroughAnEventAutomaton() {
		JaniModel m = batteryModel();
		assertEquals(List.of("Drainer", "Manager", GlobalTimer.AUTOMATON_NAME, "level"), automatonNames(m));
		assertEquals(JaniType.of(JaniBaseType.INTEGER), m.getVariable("level.data").type);
		assertEquals(0L, m.getVariable("level.data").initial.evaluate(Map.of()));
		assertEquals(JaniType.of(JaniBaseType.BOOLEAN), m.getVariable("level.valid").type);
		assertEquals(false, m.getVariable("level.valid").initial.evaluate(Map.of()));

		Composition c = m.getComposition();
		assertEquals(Map.of("Manager", "level_on_send", "level", "level_on_send"),
		             c.getParticipants("level_on_send"));
		assertEquals(Map.of("Drainer", "level_on_receive", "level", "level_on_receive"),
		             c.getParticipants("level_on_receive"));
		assertEquals(Map.of("Drainer", "ros_time_rate.drain_on_receive",
		                    GlobalTimer.AUTOMATON_NAME, "ros_time_rate.drain_on_receive",
		                    "level", GlobalTimer.ENABLE_ACTION),
		             c.getParticipants("ros_time_rate.drain_on_receive"));
		for (Composition.Sync s : c.getSyncs())
			assertEquals(c.getElements().size(), s.vector.size());
	}

	@Test
	void marksTheEventValidWhenSending() {
		JaniModel m = batteryModel();
		Edge send = m.getAutomaton("Manager").getEdges().get(0);
		List<Edge.Assignment> as = send.destinations.get(0).assignments;
		Edge.Assignment last = as.get(as.size() - 1);
		assertEquals("level.valid", last.ref.toJani());
		assertEquals(true, last.value.evaluate(Map.of()));
	}

	@Test
	void passesArrayLengthsWithEvents() {
		StateMachine sender = new StateMachine("scanner")
				.addLocation("l", true)
				.declareEventField("scan", "ranges", "int32[]");
		sender.addEdge("l", "scan_on_send", null)
				.addDestination("l")
				.assign("scan.ranges", "[1, 2]");
		StateMachine receiver = new StateMachine("planner")
				.addLocation("l", true)
				.addVariable("n", "int32", null);
		receiver.addEdge("l", "scan_on_receive", null)
				.addDestination("l")
				.assign("n", "_event.ranges.length");
		JaniModel m = Convert.convert(List.of(sender, receiver), List.of(), ConversionOptions.DEFAULT);

		assertEquals(0L, m.getVariable("scan.ranges.length").initial.evaluate(Map.of()));
		List<Edge.Assignment> send = m.getAutomaton("scanner").getEdges().get(0).destinations.get(0).assignments;
		assertEquals("scan.ranges.length", send.get(1).ref.toJani());
		assertEquals(2L, send.get(1).value.evaluate(Map.of()));
		assertEquals(1, send.get(1).index);
		Edge.Assignment read = m.getAutomaton("planner").getEdges().get(0).destinations.get(0).assignments.get(0);
		assertEquals("scan.ranges.length", read.value.toJani());
	}

	@Test
	void comparesLocalArraysWithLiterals() {
		StateMachine sm = new StateMachine("checker")
				.addLocation("l", true)
				.addVariable("arr", "int32[]", "[]");
		sm.addEdge("l", "check", "arr == [1, 2]").addDestination("l");
		JaniModel m = Convert.convert(List.of(sm), List.of(), ConversionOptions.DEFAULT);

		Edge check = m.getAutomaton("checker").getEdges().get(0);
		assertTrue(check.guard.getReferencedVariables().contains("arr.length"));
		assertEquals(true, check.guard.evaluate(Map.of("arr", List.of(1L, 2L, 0L), "arr.length", 2L)));
		assertEquals(false, check.guard.evaluate(Map.of("arr", List.of(1L, 2L, 0L), "arr.length", 3L)));
		assertEquals(false, check.guard.evaluate(Map.of("arr", List.of(1L, 3L, 0L), "arr.length", 2L)));
	}

	@Test
	void readsEventFieldsFromTheEventVariables() {
		JaniModel m = batteryModel();
		Edge receive = null;
		for (Edge e : m.getAutomaton("Drainer").getEdges()) {
			if (e.action.equals("level_on_receive"))
				receive = e;
		}
		assertEquals(Map.of("op", "<", "left", "level.data", "right", 20L), receive.guard.toJani());
	}

	@Test
	void keepsOptionsInTheOutput() {
		JaniModel m = batteryModel();
		assertEquals(ConversionOptions.DEFAULT_MODEL_NAME, m.getName());
		assertEquals(Set.of(Convert.FEATURE_ARRAYS, Convert.FEATURE_TRIGONOMETRY), m.getFeatures());
		Automaton timer = m.getAutomaton(GlobalTimer.AUTOMATON_NAME);
		Edge tick = timer.getEdges().get(0);
		assertEquals(false, tick.guard.evaluate(Map.of("t", 100L, "drain_needed", false)));
		assertEquals(true, tick.guard.evaluate(Map.of("t", 99L, "drain_needed", false)));
	}

	@Test
	void convertsASingleAutomaton() {
		StateMachine sm = new StateMachine("counter")
				.addLocation("Initial", true)
				.addVariable("x", "int32", null);
		sm.addEdge("Initial", null, null)
				.addDestination("Initial")
				.assign("x", "42");
		JaniModel m = Convert.convert(List.of(sm), List.of(), ConversionOptions.DEFAULT.withModelName("single"));

		Automaton a = m.getAutomaton("counter");
		assertEquals(Set.of("Initial"), a.getInitialLocations());
		assertEquals(0L, a.getVariables().get("x").initial.evaluate(Map.of()));
		assertEquals(1, a.getEdges().size());
		Edge e = a.getEdges().get(0);
		assertEquals("counter_action_0", e.action);
		assertEquals(1, e.destinations.get(0).assignments.size());
		assertEquals(42L, e.destinations.get(0).assignments.get(0).value.evaluate(Map.of()));
		assertEquals(Map.of("counter", "counter_action_0"), m.getComposition().getParticipants("counter_action_0"));
	}

	@Test
	void prunesEmptySelfLoopsOfHandlers() {
		StateMachine handler = new StateMachine("srv_handler_add")
				.addLocation("ready", true);
		handler.addEdge("ready", null, null).addDestination("ready");
		handler.addEdge("ready", "srv_add_response_on_send", null).addDestination("ready");
		StateMachine client = new StateMachine("client")
				.addLocation("waiting", true);
		client.addEdge("waiting", null, null).addDestination("waiting");
		client.addEdge("waiting", "srv_add_response_on_receive", null).addDestination("waiting");

		JaniModel m = Convert.convert(List.of(handler, client), List.of(), ConversionOptions.DEFAULT);
		assertEquals(Set.of("srv_add_response_on_send"), m.getAutomaton("srv_handler_add").getActions());
		assertEquals(Set.of("client_action_0", "srv_add_response_on_receive"), m.getAutomaton("client").getActions());
		assertFalse(m.getComposition().hasSync("srv_handler_add_action_0"));
		assertTrue(m.getComposition().hasSync("client_action_0"));
	}

	@Test
	void expandsRandomAssignments() {
		StateMachine sm = new StateMachine("dice")
				.addLocation("roll", true)
				.addVariable("face", "int32", "1");
		sm.addEdge("roll", null, null)
				.addDestination("roll")
				.assign("face", "Math.floor(Math.random() * 4) + 1");
		JaniModel m = Convert.convert(List.of(sm), List.of(), ConversionOptions.DEFAULT.withDistributionResolution(4));
		Automaton a = m.getAutomaton("dice");
		assertEquals(3, a.getEdges().size());
		Edge branch = a.getEdges().get(1);
		ArrayList<Object> faces = new ArrayList<>();
		for (Edge.Destination d : branch.destinations)
			faces.add(d.assignments.get(0).value.evaluate(Map.of()));
		assertEquals(List.of(1L, 2L, 3L, 4L), faces);
	}

	@Test
	void writesTheModelToAFile(@TempDir Path dir) throws Exception {
		String file = dir.resolve("battery.jani").toString();
		JaniModel m = batteryModel();
		Convert.writeJaniFile(m, file);
		JaniModel read = JaniModel.readJaniFile(file);
		assertEquals(automatonNames(m), automatonNames(read));
		assertEquals(m.toJani(), read.toJani());
	}
}
