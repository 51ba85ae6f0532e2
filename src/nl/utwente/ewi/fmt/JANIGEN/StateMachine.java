package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Description of one state machine, as delivered by the front end:
 * locations, typed variables and edges, with all expressions still in
 * source form. Declarations are kept in the order they are made.
 */
public class StateMachine
{
	public static class VariableDeclaration {
		public final String name;
		/** E.g. "bool", "int32", "float64[]" or "int16[5]". */
		public final String type;
		/** Null for the default value of the type. */
		public final String initialValue;
		public final boolean isTransient;

		VariableDeclaration(String name, String type, String initialValue, boolean isTransient)
		{
			this.name = name;
			this.type = type;
			this.initialValue = initialValue;
			this.isTransient = isTransient;
		}
	}

	public static class AssignmentDeclaration {
		public final String target;
		public final String value;
		/** Null to order assignments by declaration. */
		public final Integer index;

		AssignmentDeclaration(String target, String value, Integer index)
		{
			this.target = target;
			this.value = value;
			this.index = index;
		}
	}

	public static class DestinationDeclaration {
		public final String target;
		public final String probability;
		private final ArrayList<AssignmentDeclaration> assignments = new ArrayList<>();

		DestinationDeclaration(String target, String probability)
		{
			this.target = target;
			this.probability = probability;
		}

		public DestinationDeclaration assign(String target, String value) {
			assignments.add(new AssignmentDeclaration(target, value, null));
			return this;
		}

		public DestinationDeclaration assign(String target, String value, int index) {
			assignments.add(new AssignmentDeclaration(target, value, index));
			return this;
		}

		public List<AssignmentDeclaration> getAssignments() {
			return Collections.unmodifiableList(assignments);
		}
	}

	public static class EdgeDeclaration {
		public final String source;
		/** Null to let the automaton name the action. */
		public final String action;
		/** Null if the edge is always enabled. */
		public final String guard;
		private final ArrayList<DestinationDeclaration> destinations = new ArrayList<>();

		EdgeDeclaration(String source, String action, String guard)
		{
			this.source = source;
			this.action = action;
			this.guard = guard;
		}

		public DestinationDeclaration addDestination(String target) {
			return addDestination(target, null);
		}

		public DestinationDeclaration addDestination(String target, String probability) {
			DestinationDeclaration ret = new DestinationDeclaration(target, probability);
			destinations.add(ret);
			return ret;
		}

		public List<DestinationDeclaration> getDestinations() {
			return Collections.unmodifiableList(destinations);
		}
	}

	public final String name;
	private final LinkedHashSet<String> locations = new LinkedHashSet<>();
	private final LinkedHashSet<String> initialLocations = new LinkedHashSet<>();
	private final ArrayList<VariableDeclaration> variables = new ArrayList<>();
	private final ArrayList<EdgeDeclaration> edges = new ArrayList<>();
	/* Event name -> field name -> type tag. */
	private final LinkedHashMap<String, LinkedHashMap<String, String>> payloads = new LinkedHashMap<>();

	public StateMachine(String name)
	{
		this.name = name;
	}

	public StateMachine addLocation(String location, boolean initial) {
		locations.add(location);
		if (initial)
			initialLocations.add(location);
		return this;
	}

	public StateMachine addVariable(String var, String type, String initialValue) {
		return addVariable(var, type, initialValue, false);
	}

	public StateMachine addVariable(String var, String type, String initialValue, boolean isTransient) {
		variables.add(new VariableDeclaration(var, type, initialValue, isTransient));
		return this;
	}

	public EdgeDeclaration addEdge(String source, String action, String guard) {
		EdgeDeclaration ret = new EdgeDeclaration(source, action, guard);
		edges.add(ret);
		return ret;
	}

	/**
	 * Declare a field of an event this machine sends or receives.
	 */
	public StateMachine declareEventField(String event, String field, String type) {
		LinkedHashMap<String, String> fields = payloads.get(event);
		if (fields == null) {
			fields = new LinkedHashMap<>();
			payloads.put(event, fields);
		}
		fields.put(field, type);
		return this;
	}

	public Set<String> getLocations() {
		return Collections.unmodifiableSet(locations);
	}

	public Set<String> getInitialLocations() {
		return Collections.unmodifiableSet(initialLocations);
	}

	public List<VariableDeclaration> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public List<EdgeDeclaration> getEdges() {
		return Collections.unmodifiableList(edges);
	}

	public Map<String, ? extends Map<String, String>> getEventFields() {
		return Collections.unmodifiableMap(payloads);
	}
}
