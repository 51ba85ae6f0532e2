package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;

/**
 * A single automaton of the model: named locations, local variables
 * and edges between the locations. Edges without an action are given
 * one of the form {@code <name>_action_<n>} when they are added.
 */
public class Automaton
{
	private final String name;
	private final LinkedHashSet<String> locations = new LinkedHashSet<>();
	private final LinkedHashSet<String> initialLocations = new LinkedHashSet<>();
	private final LinkedHashMap<String, JaniVariable> variables = new LinkedHashMap<>();
	private final ArrayList<Edge> edges = new ArrayList<>();
	/* Number of edges ever added, used for generated action names. */
	private int edgeCounter;

	public Automaton(String name)
	{
		if (name == null || name.isEmpty())
			throw new InvalidModelException("Automata need a name");
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public void addLocation(String location) {
		addLocation(location, false);
	}

	public void addLocation(String location, boolean initial) {
		if (!locations.add(location))
			throw new InvalidModelException("Duplicate location '" + location + "' in automaton '" + name + "'");
		if (initial)
			initialLocations.add(location);
	}

	public void setInitial(String location) {
		checkLocation(location);
		initialLocations.add(location);
	}

	public boolean hasLocation(String location) {
		return locations.contains(location);
	}

	public Set<String> getLocations() {
		return Collections.unmodifiableSet(locations);
	}

	public Set<String> getInitialLocations() {
		return Collections.unmodifiableSet(initialLocations);
	}

	public void addVariable(JaniVariable v) {
		if (variables.containsKey(v.name))
			throw new InvalidModelException("Duplicate variable '" + v.name + "' in automaton '" + name + "'");
		variables.put(v.name, v);
	}

	public Map<String, JaniVariable> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	private void checkLocation(String location) {
		if (!locations.contains(location))
			throw new InvalidModelException("Automaton '" + name + "' has no location '" + location + "'");
	}

	private Edge checkEdge(Edge e) {
		checkLocation(e.location);
		for (Edge.Destination d : e.destinations)
			checkLocation(d.location);
		return e;
	}

	/**
	 * Add an edge, naming its action if it has none.
	 *
	 * @return The edge as it was added.
	 */
	public Edge addEdge(Edge e) {
		checkEdge(e);
		int id = edgeCounter++;
		if (e.action == null)
			e = e.withAction(name + "_action_" + id);
		edges.add(e);
		return e;
	}

	/** Replace the edge at the given position, keeping its action. */
	public void replaceEdge(int index, Edge e) {
		if (!edges.get(index).action.equals(e.action))
			throw new InvalidModelException("Replacement edge should keep action '" + edges.get(index).action + "'");
		edges.set(index, checkEdge(e));
	}

	public List<Edge> getEdges() {
		return Collections.unmodifiableList(edges);
	}

	/** All actions of the edges of this automaton. */
	public Set<String> getActions() {
		TreeSet<String> ret = new TreeSet<>();
		for (Edge e : edges)
			ret.add(e.action);
		return ret;
	}

	/** @return The number of removed edges. */
	public int removeEdgesWithAction(String action) {
		int removed = 0;
		Iterator<Edge> it = edges.iterator();
		while (it.hasNext()) {
			if (action.equals(it.next().action)) {
				it.remove();
				removed++;
			}
		}
		return removed;
	}

	/** @return The number of removed edges. */
	public int removeEmptySelfLoopEdges() {
		int removed = 0;
		Iterator<Edge> it = edges.iterator();
		while (it.hasNext()) {
			if (it.next().isEmptySelfLoop()) {
				it.remove();
				removed++;
			}
		}
		return removed;
	}

	/** Apply a rewrite to every expression of the edges and variables. */
	void transformExpressions(Function<Expression, Expression> f) {
		for (int i = 0; i < edges.size(); i++)
			edges.set(i, edges.get(i).transform(f));
		for (JaniVariable v : List.copyOf(variables.values()))
			variables.put(v.name, v.withInitial(f.apply(v.initial)));
	}

	private boolean isGeneratedAction(String action) {
		String prefix = name + "_action_";
		if (!action.startsWith(prefix) || action.length() == prefix.length())
			return false;
		for (int i = prefix.length(); i < action.length(); i++) {
			if (!Character.isDigit(action.charAt(i)))
				return false;
		}
		return true;
	}

	/**
	 * Add the locations, variables and edges of another fragment of
	 * this automaton. Generated action names of the fragment are
	 * generated anew.
	 */
	public void merge(Automaton other) {
		if (!name.equals(other.name))
			throw new InvalidModelException("Cannot merge automaton '" + other.name + "' into '" + name + "'");
		for (String var : other.variables.keySet()) {
			if (variables.containsKey(var))
				throw new InvalidModelException("Variable '" + var + "' declared twice in automaton '" + name + "'");
		}
		locations.addAll(other.locations);
		initialLocations.addAll(other.initialLocations);
		variables.putAll(other.variables);
		for (Edge e : other.edges) {
			if (isGeneratedAction(e.action))
				e = e.withAction(null);
			addEdge(e);
		}
	}

	public Map<String, Object> toJani() {
		if (initialLocations.isEmpty())
			throw new InvalidModelException("Automaton '" + name + "' has no initial location");
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("name", name);
		ArrayList<Object> locs = new ArrayList<>();
		for (String l : new TreeSet<>(locations))
			locs.add(Map.of("name", l));
		ret.put("locations", locs);
		ret.put("initial-locations", new ArrayList<>(initialLocations));
		ArrayList<Object> vars = new ArrayList<>();
		for (JaniVariable v : variables.values())
			vars.add(v.toJani());
		ret.put("variables", vars);
		ArrayList<Object> es = new ArrayList<>();
		for (Edge e : edges)
			es.add(e.toJani());
		ret.put("edges", es);
		return ret;
	}

	public static Automaton fromJani(Object o) {
		Map<?, ?> m = JaniUtils.asMap(o, "Automaton");
		Automaton ret = new Automaton(JaniUtils.getString(m, "name"));
		for (Object l : JaniUtils.getList(m, "locations"))
			ret.addLocation(JaniUtils.getString(JaniUtils.asMap(l, "Location"), "name"));
		for (Object l : JaniUtils.getList(m, "initial-locations")) {
			if (!(l instanceof String))
				throw new IllegalArgumentException("Initial location should be a string, not: " + l);
			ret.setInitial((String)l);
		}
		for (Object v : JaniUtils.getList(m, "variables"))
			ret.addVariable(JaniVariable.fromJani(v));
		for (Object e : JaniUtils.getList(m, "edges"))
			ret.addEdge(Edge.fromJani(e));
		return ret;
	}

	public String toString() {
		return "Automaton " + name + " (" + locations.size() + " locations, " + edges.size() + " edges)";
	}
}
