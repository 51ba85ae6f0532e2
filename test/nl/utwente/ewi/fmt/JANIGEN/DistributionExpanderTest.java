package nl.utwente.ewi.fmt.JANIGEN;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.JANIGEN.Edge.Assignment;
import nl.utwente.ewi.fmt.JANIGEN.Edge.Destination;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.DistributionExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;
import nl.utwente.ewi.fmt.JANIGEN.expression.ExpressionTranslator;

class DistributionExpanderTest
{
	private static JaniModel robot(Assignment... assignments) {
		JaniModel m = new JaniModel("random");
		Automaton a = new Automaton("robot");
		a.addLocation("start", true);
		a.addLocation("end");
		a.addVariable(new JaniVariable("x", JaniType.of(JaniBaseType.REAL), null, true));
		a.addVariable(new JaniVariable("y", JaniType.of(JaniBaseType.INTEGER)));
		a.addEdge(new Edge("start", "move", null,
				List.of(new Destination("end", null, List.of(assignments)))));
		m.addAutomaton(a);
		return m;
	}

	private static double probability(Destination d) {
		return ((Number)d.probability.evaluate(Map.of())).doubleValue();
	}

	@Test
	void keepsLocationsOfEdgesWithTheSameActionApart() {
		JaniModel m = new JaniModel("rng");
		Automaton a = new Automaton("receiver");
		a.addLocation("s", true);
		a.addVariable(new JaniVariable("x", JaniType.of(JaniBaseType.REAL), null, true));
		Expression low = ExpressionTranslator.translate("x < 0.5");
		Expression high = ExpressionTranslator.translate("x >= 0.5");
		for (Expression guard : List.of(low, high)) {
			a.addEdge(new Edge("s", "go_on_receive", guard,
					List.of(new Destination("s", null,
						List.of(new Assignment("x", DistributionExpression.uniform(0, 1), 0))))));
		}
		m.addAutomaton(a);
		DistributionExpander.expand(m, 4);

		assertTrue(a.hasLocation("s_go_on_receive_dest_0_expanded_assign_0"));
		assertTrue(a.hasLocation("s_go_on_receive_1_dest_0_expanded_assign_0"));
		assertEquals(6, a.getEdges().size());
		assertEquals("s_go_on_receive_dest_0_expanded_assign_0", a.getEdges().get(0).destinations.get(0).location);
		assertEquals("s_go_on_receive_1_dest_0_expanded_assign_0", a.getEdges().get(1).destinations.get(0).location);
		assertEquals(high, a.getEdges().get(1).guard);
	}

	@Test
	void branchesOverEquallyLikelyValues() {
		JaniModel m = robot(new Assignment("x", DistributionExpression.uniform(0, 1), 0),
		                    new Assignment("y", new ConstantExpression(5L), 1));
		DistributionExpander.expand(m, 100);

		Automaton a = m.getAutomaton("robot");
		String expanded = "start_move_dest_0_expanded_assign_0";
		String after = "start_move_dest_0_after_assign_0";
		assertEquals(Set.of("start", "end", expanded, after), a.getLocations());
		List<Edge> edges = a.getEdges();
		assertEquals(3, edges.size());

		Edge move = edges.get(0);
		assertEquals("move", move.action);
		assertEquals(expanded, move.destinations.get(0).location);
		assertTrue(move.destinations.get(0).assignments.isEmpty());

		Edge branch = edges.get(1);
		assertEquals(expanded, branch.location);
		assertEquals(100, branch.destinations.size());
		double total = 0;
		for (Destination d : branch.destinations) {
			assertEquals(after, d.location);
			assertEquals(0.01, probability(d), 1e-12);
			total += probability(d);
		}
		assertEquals(1.0, total, 1e-9);
		Assignment first = branch.destinations.get(0).assignments.get(0);
		assertEquals(0.0, first.value.evaluate(Map.of()));
		assertEquals(0.5, branch.destinations.get(50).assignments.get(0).value.evaluate(Map.of()));

		Edge rest = edges.get(2);
		assertEquals(after, rest.location);
		assertEquals("end", rest.destinations.get(0).location);
		assertEquals(List.of("y"), List.of(rest.destinations.get(0).assignments.get(0).ref.toJani()));
		assertEquals(1, rest.destinations.get(0).assignments.get(0).index);
	}

	@Test
	void givesNewEdgesTheirOwnSyncs() {
		JaniModel m = robot(new Assignment("x", DistributionExpression.uniform(0, 1), 0));
		DistributionExpander.expand(m, 4);
		Composition c = m.getComposition();
		assertEquals(Set.of("move", "robot_action_1", "robot_action_2"),
		             c.getSyncsForElement("robot"));
		for (Composition.Sync s : c.getSyncs())
			assertEquals(List.of(s.result), s.vector);
	}

	@Test
	void expandsLaterAssignmentsOnTheContinuationEdge() {
		JaniModel m = robot(new Assignment("x", DistributionExpression.uniform(0, 1), 0),
		                    new Assignment("y", ExpressionTranslator.translate("Math.floor(Math.random() * 10)"), 1));
		DistributionExpander.expand(m, 2);
		List<Edge> edges = m.getAutomaton("robot").getEdges();
		assertEquals(5, edges.size());
		for (Edge e : edges) {
			for (Destination d : e.destinations) {
				for (Assignment as : d.assignments)
					assertFalse(as.value.containsDistribution());
			}
		}
		assertTrue(m.getAutomaton("robot").hasLocation("start_move_dest_0_after_assign_0_robot_action_2_dest_0_expanded_assign_0"));
	}

	@Test
	void combinesDistributionsOfOneAssignment() {
		Expression sum = ExpressionTranslator.translate("Math.random() + Math.random()");
		JaniModel m = robot(new Assignment("x", sum, 0));
		DistributionExpander.expand(m, 3);
		Edge branch = m.getAutomaton("robot").getEdges().get(1);
		assertEquals(9, branch.destinations.size());
		assertEquals(1.0 / 9, probability(branch.destinations.get(0)), 1e-12);
	}

	@Test
	void leavesDeterministicEdgesAlone() {
		JaniModel m = robot(new Assignment("y", new ConstantExpression(1L), 0));
		DistributionExpander.expand(m, 10);
		assertEquals(1, m.getAutomaton("robot").getEdges().size());
		assertEquals(Set.of("start", "end"), m.getAutomaton("robot").getLocations());
	}

	@Test
	void rejectsRandomInitialValues() {
		JaniModel m = robot();
		m.addVariable(new JaniVariable("noise", JaniType.of(JaniBaseType.REAL),
				DistributionExpression.uniform(0, 1), true));
		assertThrows(ConfigurationException.class, () -> DistributionExpander.expand(m, 10));
		assertThrows(ConfigurationException.class, () -> DistributionExpander.expand(robot(), 0));
	}
}
