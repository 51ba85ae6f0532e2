package nl.utwente.ewi.fmt.JANIGEN;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.ExpressionTranslator;

class AutomatonTest
{
	private static Automaton twoLocations(String name) {
		Automaton a = new Automaton(name);
		a.addLocation("idle", true);
		a.addLocation("busy");
		return a;
	}

	@Test
	void namesAnonymousActionsUniquely() {
		Automaton a = twoLocations("sensor");
		Edge first = a.addEdge(new Edge("idle", null, "busy"));
		a.addEdge(new Edge("busy", "done", "idle"));
		Edge third = a.addEdge(new Edge("busy", null, "idle"));
		assertEquals("sensor_action_0", first.action);
		assertEquals("sensor_action_2", third.action);
		assertEquals(Set.of("sensor_action_0", "done", "sensor_action_2"), a.getActions());
		a.removeEdgesWithAction("sensor_action_2");
		assertEquals("sensor_action_3", a.addEdge(new Edge("idle", null, "idle")).action);
	}

	@Test
	void rejectsUnknownLocations() {
		Automaton a = twoLocations("a");
		assertThrows(InvalidModelException.class, () -> a.addEdge(new Edge("idle", "go", "nowhere")));
		assertThrows(InvalidModelException.class, () -> a.addEdge(new Edge("elsewhere", "go", "idle")));
		assertThrows(InvalidModelException.class, () -> a.addLocation("idle"));
		assertThrows(InvalidModelException.class, () -> a.setInitial("nowhere"));
		assertTrue(a.getEdges().isEmpty());
	}

	@Test
	void replacesEdgesOnlyWithTheSameAction() {
		Automaton a = twoLocations("a");
		a.addEdge(new Edge("idle", "go", "busy"));
		a.replaceEdge(0, new Edge("idle", "go", "idle"));
		assertEquals("idle", a.getEdges().get(0).destinations.get(0).location);
		assertThrows(InvalidModelException.class, () -> a.replaceEdge(0, new Edge("idle", "stop", "idle")));
	}

	@Test
	void removesOnlyEmptySelfLoops() {
		Automaton a = twoLocations("srv_handler_add");
		a.addEdge(new Edge("idle", "wait", "idle"));
		a.addEdge(new Edge("idle", "always", ConstantExpression.TRUE,
				List.of(new Edge.Destination("idle"))));
		a.addEdge(new Edge("idle", "guarded", ExpressionTranslator.translate("x > 0"),
				List.of(new Edge.Destination("idle"))));
		a.addEdge(new Edge("idle", "count", null, List.of(new Edge.Destination("idle", null,
				List.of(new Edge.Assignment("x", new ConstantExpression(1L), 0))))));
		a.addEdge(new Edge("idle", "start", "busy"));
		assertEquals(2, a.removeEmptySelfLoopEdges());
		assertEquals(Set.of("guarded", "count", "start"), a.getActions());
		assertEquals(0, a.removeEmptySelfLoopEdges());
	}

	@Test
	void mergesFragmentsOfTheSameAutomaton() {
		Automaton a = twoLocations("robot");
		a.addVariable(new JaniVariable("x", JaniType.of(JaniBaseType.INTEGER)));
		a.addEdge(new Edge("idle", null, "busy"));
		Automaton b = new Automaton("robot");
		b.addLocation("charging");
		b.addLocation("idle");
		b.addVariable(new JaniVariable("battery", JaniType.of(JaniBaseType.INTEGER)));
		b.addEdge(new Edge("charging", null, "idle"));
		a.merge(b);

		assertEquals(Set.of("idle", "busy", "charging"), a.getLocations());
		assertEquals(Set.of("idle"), a.getInitialLocations());
		assertEquals(Set.of("x", "battery"), a.getVariables().keySet());
		assertEquals(Set.of("robot_action_0", "robot_action_1"), a.getActions());

		assertThrows(InvalidModelException.class, () -> a.merge(new Automaton("other")));
		Automaton clash = new Automaton("robot");
		clash.addVariable(new JaniVariable("x", JaniType.of(JaniBaseType.BOOLEAN)));
		assertThrows(InvalidModelException.class, () -> a.merge(clash));
	}

	@Test
	void writesSortedLocations() {
		Automaton a = twoLocations("a");
		a.addEdge(new Edge("idle", "go", "busy"));
		Map<String, Object> jani = a.toJani();
		assertEquals(List.of(Map.of("name", "busy"), Map.of("name", "idle")), jani.get("locations"));
		assertEquals(List.of("idle"), jani.get("initial-locations"));
		assertEquals(List.of(Map.of("location", "idle", "action", "go",
		                            "destinations", List.of(Map.of("location", "busy", "assignments", List.of())))),
		             jani.get("edges"));
		assertThrows(InvalidModelException.class, () -> new Automaton("b").toJani());
	}
}
