package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.StateMachine.AssignmentDeclaration;
import nl.utwente.ewi.fmt.JANIGEN.StateMachine.DestinationDeclaration;
import nl.utwente.ewi.fmt.JANIGEN.StateMachine.EdgeDeclaration;
import nl.utwente.ewi.fmt.JANIGEN.StateMachine.VariableDeclaration;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayInfo;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;
import nl.utwente.ewi.fmt.JANIGEN.expression.ExpressionTranslator;
import nl.utwente.ewi.fmt.JANIGEN.expression.Operator;
import nl.utwente.ewi.fmt.JANIGEN.expression.OperatorExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.VariableExpression;

/**
 * Builds the automaton of a state machine, and records the events it
 * sends and receives. An edge whose action ends in
 * {@value Event#SEND_SUFFIX} sends the event named by the rest of the
 * action, one ending in {@value Event#RECEIVE_SUFFIX} receives it.
 *
 * On receiving edges, the fields of the received event can be read
 * as {@code _event.<field>}. Sending edges set {@code <event>.valid}.
 *
 * Every array variable {@code a} has a companion {@code a.length},
 * which is updated by an extra assignment after each write to the
 * array.
 */
public class AutomatonAssembler
{
	public static final String EVENT_PREFIX = "_event.";

	private final EventRegistry events;
	private final ConversionOptions options;

	public AutomatonAssembler(EventRegistry events, ConversionOptions options)
	{
		this.events = events;
		this.options = options;
	}

	public Automaton assemble(StateMachine sm) {
		Automaton ret = new Automaton(sm.name);
		for (String loc : sm.getLocations())
			ret.addLocation(loc, sm.getInitialLocations().contains(loc));
		if (ret.getInitialLocations().isEmpty())
			throw new InvalidModelException("State machine '" + sm.name + "' has no initial location");

		HashMap<String, JaniType> types = new HashMap<>();
		for (Map.Entry<String, ? extends Map<String, String>> ev : sm.getEventFields().entrySet()) {
			LinkedHashMap<String, JaniType> payload = new LinkedHashMap<>();
			for (Map.Entry<String, String> field : ev.getValue().entrySet()) {
				JaniType t = JaniUtils.parseTypeTag(field.getValue(), options.maxArraySize);
				if (t.isArray())
					t = EventSynchronizer.payloadType(t, options.maxArraySize);
				payload.put(field.getKey(), t);
				types.put(ev.getKey() + "." + field.getKey(), t);
			}
			events.getOrCreate(ev.getKey()).setPayload(payload);
		}

		for (VariableDeclaration v : sm.getVariables()) {
			JaniType t = JaniUtils.parseTypeTag(v.type, options.maxArraySize);
			Expression init = null;
			if (v.initialValue != null)
				init = ExpressionTranslator.translate(v.initialValue, t.shape, arrayShapes(types));
			ret.addVariable(new JaniVariable(v.name, t, init, v.isTransient));
			types.put(v.name, t);
			if (t.isArray()) {
				long length = 0;
				if (v.initialValue != null)
					length = Math.max(ExpressionTranslator.arrayLiteralLength(v.initialValue), 0);
				ret.addVariable(new JaniVariable(v.name + JaniModel.LENGTH_SUFFIX,
						JaniType.of(JaniBaseType.INTEGER),
						new ConstantExpression(length), v.isTransient));
			}
		}

		Map<String, ArrayInfo> arrays = arrayShapes(types);
		for (EdgeDeclaration e : sm.getEdges()) {
			String received = eventName(e.action, Event.RECEIVE_SUFFIX);
			String sent = eventName(e.action, Event.SEND_SUFFIX);
			Expression guard = null;
			if (e.guard != null)
				guard = renameEventFields(ExpressionTranslator.translate(e.guard, null, arrays), received);
			ArrayList<Edge.Destination> dests = new ArrayList<>();
			for (DestinationDeclaration d : e.getDestinations()) {
				Edge.Destination dest = assembleDestination(d, types, arrays, received);
				if (sent != null)
					dest = markValid(dest, sent);
				dests.add(dest);
			}
			Edge edge = ret.addEdge(new Edge(e.source, e.action, guard, dests));
			registerEvent(sm.name, edge.action);
		}
		return ret;
	}

	private Edge.Destination assembleDestination(DestinationDeclaration d,
	                                             Map<String, JaniType> types,
	                                             Map<String, ArrayInfo> arrays,
	                                             String received)
	{
		Expression prob = null;
		if (d.probability != null)
			prob = renameEventFields(ExpressionTranslator.translate(d.probability, null, arrays), received);
		ArrayList<Edge.Assignment> writes = new ArrayList<>();
		/* Length update following each write, or null. */
		ArrayList<Edge.Assignment> lengths = new ArrayList<>();
		List<AssignmentDeclaration> decls = d.getAssignments();
		for (int i = 0; i < decls.size(); i++) {
			AssignmentDeclaration a = decls.get(i);
			Expression ref = ExpressionTranslator.translate(a.target, null, arrays);
			ArrayInfo shape = null;
			if (ref instanceof VariableExpression) {
				JaniType t = types.get(((VariableExpression)ref).variable);
				if (t != null)
					shape = t.shape;
			}
			Expression value = ExpressionTranslator.translate(a.value, shape, arrays);
			int index = a.index == null ? i : a.index;
			Edge.Assignment write = new Edge.Assignment(renameEventFields(ref, received),
					renameEventFields(value, received), index);
			writes.add(write);
			lengths.add(lengthUpdate(write, a.value, types));
		}
		return new Edge.Destination(d.target, prob, withLengthUpdates(writes, lengths));
	}

	/**
	 * The assignment that keeps {@code <array>.length} up to date after
	 * a write to the array, or null if the write needs none.
	 */
	private static Edge.Assignment lengthUpdate(Edge.Assignment write, String source,
	                                            Map<String, JaniType> types)
	{
		if (write.ref instanceof VariableExpression) {
			String array = ((VariableExpression)write.ref).variable;
			if (!isArray(array, types))
				return null;
			Expression length;
			int literal = ExpressionTranslator.arrayLiteralLength(source);
			if (literal >= 0) {
				length = new ConstantExpression((long)literal);
			} else if (write.value instanceof VariableExpression
			           && isArray(((VariableExpression)write.value).variable, types)) {
				length = new VariableExpression(((VariableExpression)write.value).variable + JaniModel.LENGTH_SUFFIX);
			} else {
				return null;
			}
			return new Edge.Assignment(array + JaniModel.LENGTH_SUFFIX, length, write.index);
		}
		OperatorExpression access = (OperatorExpression)write.ref;
		Expression target = access.getOperand("exp");
		if (!(target instanceof VariableExpression))
			return null;
		String array = ((VariableExpression)target).variable;
		if (!isArray(array, types))
			return null;
		VariableExpression length = new VariableExpression(array + JaniModel.LENGTH_SUFFIX);
		Expression atLeast = OperatorExpression.binary(Operator.ADD,
				access.getOperand("index"), new ConstantExpression(1L));
		return new Edge.Assignment(length,
				OperatorExpression.binary(Operator.MAX, atLeast, length),
				write.index);
	}

	private static boolean isArray(String variable, Map<String, JaniType> types) {
		JaniType t = types.get(variable);
		return t != null && t.isArray();
	}

	/**
	 * Place every length update directly after the writes with the
	 * same index, moving later writes one index up.
	 */
	private static List<Edge.Assignment> withLengthUpdates(List<Edge.Assignment> writes,
	                                                       List<Edge.Assignment> lengths)
	{
		TreeMap<Integer, List<Integer>> byIndex = new TreeMap<>();
		for (int i = 0; i < writes.size(); i++) {
			Integer index = writes.get(i).index;
			List<Integer> group = byIndex.get(index);
			if (group == null) {
				group = new ArrayList<>();
				byIndex.put(index, group);
			}
			group.add(i);
		}
		ArrayList<Edge.Assignment> ret = new ArrayList<>();
		int shift = 0;
		for (List<Integer> group : byIndex.values()) {
			boolean updated = false;
			for (int i : group) {
				Edge.Assignment w = writes.get(i);
				ret.add(new Edge.Assignment(w.ref, w.value, w.index + shift));
			}
			for (int i : group) {
				Edge.Assignment l = lengths.get(i);
				if (l == null)
					continue;
				ret.add(new Edge.Assignment(l.ref, l.value, l.index + shift + 1));
				updated = true;
			}
			if (updated)
				shift++;
		}
		return ret;
	}

	/** Set {@code <event>.valid} after the other assignments of a send. */
	private static Edge.Destination markValid(Edge.Destination dest, String event) {
		String valid = event + EventSynchronizer.VALID_SUFFIX;
		int index = 0;
		for (Edge.Assignment a : dest.assignments) {
			if (a.ref instanceof VariableExpression && ((VariableExpression)a.ref).variable.equals(valid))
				return dest;
			index = Math.max(index, a.index + 1);
		}
		ArrayList<Edge.Assignment> as = new ArrayList<>(dest.assignments);
		as.add(new Edge.Assignment(valid, ConstantExpression.TRUE, index));
		return dest.withAssignments(as);
	}

	private static Map<String, ArrayInfo> arrayShapes(Map<String, JaniType> types) {
		TreeMap<String, ArrayInfo> ret = new TreeMap<>();
		for (Map.Entry<String, JaniType> t : types.entrySet()) {
			if (t.getValue().shape != null)
				ret.put(t.getKey(), t.getValue().shape);
		}
		return ret;
	}

	private static String eventName(String action, String suffix) {
		if (action == null || !action.endsWith(suffix))
			return null;
		String ret = action.substring(0, action.length() - suffix.length());
		return ret.isEmpty() ? null : ret;
	}

	private void registerEvent(String automaton, String action) {
		String sent = eventName(action, Event.SEND_SUFFIX);
		if (sent != null)
			events.getOrCreate(sent).addSender(automaton, action);
		String received = eventName(action, Event.RECEIVE_SUFFIX);
		if (received != null)
			events.getOrCreate(received).addReceiver(automaton, action);
	}

	/** Rewrite {@code _event.<field>} to {@code <event>.<field>}. */
	static Expression renameEventFields(Expression e, String event) {
		if (event == null)
			return e;
		HashMap<String, String> renames = new HashMap<>();
		for (String var : e.getReferencedVariables()) {
			if (var.startsWith(EVENT_PREFIX))
				renames.put(var, event + "." + var.substring(EVENT_PREFIX.length()));
		}
		return renames.isEmpty() ? e : e.renameVars(renames);
	}
}
