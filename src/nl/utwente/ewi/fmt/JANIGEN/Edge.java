package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Operator;
import nl.utwente.ewi.fmt.JANIGEN.expression.OperatorExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.VariableExpression;

/** An edge of an automaton. Edges are immutable. */
public class Edge
{
	public static class Assignment {
		/** Variable or array element that is written. */
		public final Expression ref;
		public final Expression value;
		/** Assignments with a lower index are executed first. */
		public final int index;

		public Assignment(Expression ref, Expression value, int index)
		{
			boolean isRef = ref instanceof VariableExpression;
			if (ref instanceof OperatorExpression)
				isRef = ((OperatorExpression)ref).op == Operator.ARRAY_ACCESS;
			if (!isRef)
				throw new IllegalArgumentException("Can only assign to variables or array elements, not: " + ref);
			if (value == null)
				throw new IllegalArgumentException("Assignment to " + ref + " has no value");
			this.ref = ref;
			this.value = value;
			this.index = index;
		}

		public Assignment(String variable, Expression value, int index)
		{
			this(new VariableExpression(variable), value, index);
		}

		public Map<String, Object> toJani() {
			LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
			ret.put("ref", ref.toJani());
			ret.put("value", value.toJani());
			ret.put("index", (long)index);
			return ret;
		}

		public static Assignment fromJani(Object o) {
			Map<?, ?> m = JaniUtils.asMap(o, "Assignment");
			Object idx = m.get("index");
			int index = 0;
			if (idx instanceof Number)
				index = JaniUtils.safeToInteger((Number)idx);
			else if (idx != null)
				throw new IllegalArgumentException("Assignment index should be a number, not: " + idx);
			return new Assignment(Expression.fromJani(m.get("ref")),
					Expression.fromJani(m.get("value")), index);
		}
	}

	public static class Destination {
		public final String location;
		/** Null when this is the only destination of its edge. */
		public final Expression probability;
		/** The assignments, in order of their index. */
		public final List<Assignment> assignments;

		public Destination(String location, Expression probability,
		                   List<Assignment> assignments)
		{
			if (location == null)
				throw new IllegalArgumentException("Destination without location");
			this.location = location;
			this.probability = probability;
			ArrayList<Assignment> sorted = new ArrayList<>(assignments);
			sorted.sort(new Comparator<Assignment>() {
				public int compare(Assignment a, Assignment b) {
					return Integer.compare(a.index, b.index);
				}
			});
			this.assignments = List.copyOf(sorted);
		}

		public Destination(String location)
		{
			this(location, null, List.of());
		}

		public Destination withLocation(String newLocation) {
			return new Destination(newLocation, probability, assignments);
		}

		public Destination withAssignments(List<Assignment> newAssignments) {
			return new Destination(location, probability, newAssignments);
		}

		Destination transform(Function<Expression, Expression> f) {
			ArrayList<Assignment> as = new ArrayList<>(assignments.size());
			for (Assignment a : assignments)
				as.add(new Assignment(f.apply(a.ref), f.apply(a.value), a.index));
			return new Destination(location,
					probability == null ? null : f.apply(probability),
					as);
		}

		public Map<String, Object> toJani() {
			LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
			ret.put("location", location);
			if (probability != null)
				ret.put("probability", Map.of("exp", probability.toJani()));
			ArrayList<Object> as = new ArrayList<>();
			for (Assignment a : assignments)
				as.add(a.toJani());
			ret.put("assignments", as);
			return ret;
		}

		public static Destination fromJani(Object o) {
			Map<?, ?> m = JaniUtils.asMap(o, "Destination");
			Expression prob = null;
			Object p = m.get("probability");
			if (p != null)
				prob = Expression.fromJani(JaniUtils.asMap(p, "Probability").get("exp"));
			ArrayList<Assignment> as = new ArrayList<>();
			for (Object a : JaniUtils.getList(m, "assignments"))
				as.add(Assignment.fromJani(a));
			return new Destination(JaniUtils.getString(m, "location"), prob, as);
		}
	}

	public final String location;
	/** Null until the edge is added to an automaton. */
	public final String action;
	/** Null if the edge is always enabled. */
	public final Expression guard;
	public final List<Destination> destinations;

	public Edge(String location, String action, Expression guard,
	            List<Destination> destinations)
	{
		if (location == null)
			throw new InvalidModelException("Edge without source location");
		if (destinations.isEmpty())
			throw new InvalidModelException("Edge from '" + location + "' has no destinations");
		if (destinations.size() > 1) {
			for (Destination d : destinations) {
				if (d.probability == null)
					throw new InvalidModelException("Edge from '" + location + "' has multiple destinations without probabilities");
			}
		}
		this.location = location;
		this.action = action;
		this.guard = guard;
		this.destinations = List.copyOf(destinations);
	}

	/** A single-destination edge without assignments. */
	public Edge(String location, String action, String target)
	{
		this(location, action, null, List.of(new Destination(target)));
	}

	public Edge withAction(String newAction) {
		return new Edge(location, newAction, guard, destinations);
	}

	public Edge withDestinations(List<Destination> newDestinations) {
		return new Edge(location, action, guard, newDestinations);
	}

	Edge transform(Function<Expression, Expression> f) {
		ArrayList<Destination> ds = new ArrayList<>(destinations.size());
		for (Destination d : destinations)
			ds.add(d.transform(f));
		return new Edge(location, action,
				guard == null ? null : f.apply(guard), ds);
	}

	/**
	 * Whether this edge is always enabled and has no effect: a
	 * single destination back to the source location without
	 * assignments.
	 */
	public boolean isEmptySelfLoop() {
		if (destinations.size() != 1)
			return false;
		if (guard != null && !ConstantExpression.TRUE.equals(guard))
			return false;
		Destination d = destinations.get(0);
		return d.location.equals(location) && d.assignments.isEmpty();
	}

	public Map<String, Object> toJani() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("location", location);
		if (action != null)
			ret.put("action", action);
		if (guard != null)
			ret.put("guard", Map.of("exp", guard.toJani()));
		ArrayList<Object> ds = new ArrayList<>();
		for (Destination d : destinations)
			ds.add(d.toJani());
		ret.put("destinations", ds);
		return ret;
	}

	public static Edge fromJani(Object o) {
		Map<?, ?> m = JaniUtils.asMap(o, "Edge");
		Object actionO = m.get("action");
		if (actionO != null && !(actionO instanceof String))
			throw new IllegalArgumentException("Edge action should be a string, not: " + actionO);
		Expression guard = null;
		Object g = m.get("guard");
		if (g != null)
			guard = Expression.fromJani(JaniUtils.asMap(g, "Guard").get("exp"));
		ArrayList<Destination> ds = new ArrayList<>();
		for (Object d : JaniUtils.getList(m, "destinations"))
			ds.add(Destination.fromJani(d));
		return new Edge(JaniUtils.getString(m, "location"),
				(String)actionO, guard, ds);
	}

	public String toString() {
		return location + " --" + action + "--> " + destinations.get(0).location;
	}
}
