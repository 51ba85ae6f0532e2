package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.JANIGEN.Edge.Assignment;
import nl.utwente.ewi.fmt.JANIGEN.Edge.Destination;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;

/**
 * Replaces random values in assignments by probabilistic branching
 * over a finite number of equally likely values.
 *
 * The first assignment of a destination that draws a random value is
 * moved to a new edge: the destination is redirected to a location
 * {@code ..._expanded_assign_<k>}, from which an edge branches to
 * {@code ..._after_assign_<k>} once per value. A final edge from there
 * carries the remaining assignments to the original target, and is
 * expanded in turn.
 */
public class DistributionExpander
{
	private static final Logger LOG = LoggerFactory.getLogger(DistributionExpander.class);

	private DistributionExpander() {
	}

	/**
	 * Expand all distributions of the model and give the new edges
	 * their own syncs.
	 *
	 * @param options The number of values per distribution.
	 */
	public static void expand(JaniModel model, int options) {
		if (options <= 0)
			throw new ConfigurationException("Distribution resolution should be positive, not: " + options);
		for (JaniVariable v : model.getVariables())
			checkInitialValue(v, "global");
		for (Automaton a : model.getAutomata()) {
			for (JaniVariable v : a.getVariables().values())
				checkInitialValue(v, "automaton '" + a.getName() + "'");
			/* Edges added during the loop are expanded as well. */
			for (int i = 0; i < a.getEdges().size(); i++)
				expandEdge(a, i, options);
		}
		model.generateMissingSyncs();
	}

	private static void checkInitialValue(JaniVariable v, String scope) {
		if (v.initial.containsDistribution())
			throw new ConfigurationException("Variable '" + v.name + "' of " + scope + " has a random initial value");
	}

	/*
	 * Edges from the same location may share an action; those after
	 * the first include their position in the automaton.
	 */
	private static String freshBase(Automaton a, Edge edge, int index, int dest, int assign) {
		String base = edge.location + "_" + edge.action + "_dest_" + dest;
		if (isFree(a, base, assign))
			return base;
		base = edge.location + "_" + edge.action + "_" + index + "_dest_" + dest;
		for (int i = 1; !isFree(a, base, assign); i++)
			base = edge.location + "_" + edge.action + "_" + index + "_" + i + "_dest_" + dest;
		return base;
	}

	private static boolean isFree(Automaton a, String base, int assign) {
		return !a.hasLocation(base + "_expanded_assign_" + assign)
		       && !a.hasLocation(base + "_after_assign_" + assign);
	}

	private static void expandEdge(Automaton a, int index, int options) {
		Edge edge = a.getEdges().get(index);
		ArrayList<Destination> dests = new ArrayList<>(edge.destinations);
		boolean changed = false;
		for (int d = 0; d < dests.size(); d++) {
			Destination dest = dests.get(d);
			List<Assignment> as = dest.assignments;
			for (int k = 0; k < as.size(); k++) {
				Assignment random = as.get(k);
				if (!random.value.containsDistribution())
					continue;
				List<Expression> values = random.value.expandDistributions(options);
				String base = freshBase(a, edge, index, d, k);
				String expanded = base + "_expanded_assign_" + k;
				String after = base + "_after_assign_" + k;
				a.addLocation(expanded);
				a.addLocation(after);

				Expression prob = new ConstantExpression(1.0 / values.size());
				ArrayList<Destination> branches = new ArrayList<>(values.size());
				for (Expression v : values) {
					branches.add(new Destination(after, prob,
							List.of(new Assignment(random.ref, v, random.index))));
				}
				a.addEdge(new Edge(expanded, null, null, branches));
				a.addEdge(new Edge(after, null, null,
						List.of(new Destination(dest.location, null,
							as.subList(k + 1, as.size())))));
				dests.set(d, dest.withLocation(expanded)
						.withAssignments(as.subList(0, k)));
				LOG.debug("Expanded assignment to {} on edge {} of {} into {} values",
						random.ref, edge.action, a.getName(), values.size());
				changed = true;
				break;
			}
		}
		if (changed)
			a.replaceEdge(index, edge.withDestinations(dests));
	}
}
