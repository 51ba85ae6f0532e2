package nl.utwente.ewi.fmt.JANIGEN;

import java.io.IOException;
import java.io.PrintStream;
import java.util.*;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.ennoruijters.util.JSONParser;
import nl.ennoruijters.util.JSONWriter;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayInfo;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayValueExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Operator;
import nl.utwente.ewi.fmt.JANIGEN.expression.OperatorExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.VariableExpression;

/**
 * The formal model under construction: global variables and
 * constants, the automata, the composition that synchronizes them and
 * the properties to check.
 */
public class JaniModel
{
	private static final Logger LOG = LoggerFactory.getLogger(JaniModel.class);

	public static final long JANI_VERSION = 1;
	public static final String MODEL_TYPE = "mdp";
	public static final String LENGTH_SUFFIX = ".length";

	public enum JaniBaseType {
		BOOLEAN("bool"),
		INTEGER("int"),
		REAL("real");

		public final String janiName;

		JaniBaseType(String janiName) {
			this.janiName = janiName;
		}

		public static JaniBaseType fromJaniName(Object name) {
			for (JaniBaseType t : values()) {
				if (t.janiName.equals(name))
					return t;
			}
			throw new IllegalArgumentException("Unknown base type: " + name);
		}
	}

	public static class JaniType {
		public final JaniBaseType base;
		/** Number of array dimensions, 0 for scalars. */
		public final int dimensions;
		/** Maximum sizes of an array type, null if unknown. */
		public final ArrayInfo shape;
		/* Bounds of a bounded integer type, null when unbounded. */
		public final Number minimum, maximum;

		private JaniType(JaniBaseType base, int dimensions,
		                 ArrayInfo shape, Number min, Number max)
		{
			this.base = base;
			this.dimensions = dimensions;
			this.shape = shape;
			this.minimum = min;
			this.maximum = max;
		}

		public static JaniType of(JaniBaseType base) {
			return new JaniType(base, 0, null, null, null);
		}

		public static JaniType bounded(JaniBaseType base, Number min, Number max) {
			if (base == JaniBaseType.BOOLEAN)
				throw new IllegalArgumentException("Booleans cannot be bounded");
			if (min != null && max != null && min.doubleValue() > max.doubleValue())
				throw new IllegalArgumentException("Lower bound " + min + " exceeds upper bound " + max);
			return new JaniType(base, 0, null, min, max);
		}

		public static JaniType array(ArrayInfo shape) {
			return new JaniType(shape.elementType, shape.getDimensions(), shape, null, null);
		}

		/** An array type whose maximum sizes are not known. */
		public static JaniType array(JaniBaseType base, int dimensions) {
			if (dimensions <= 0)
				throw new IllegalArgumentException("Arrays need at least one dimension");
			return new JaniType(base, dimensions, null, null, null);
		}

		public boolean isArray() {
			return dimensions > 0;
		}

		/**
		 * The value of a variable of this type that is declared
		 * without initial value.
		 */
		public Expression defaultValue() {
			if (isArray()) {
				if (shape == null)
					throw new InvalidModelException("Array variables of unknown size need an initial value");
				return shape.createEmpty();
			}
			if (minimum != null && minimum.doubleValue() > 0)
				return new ConstantExpression(minimum);
			return ConstantExpression.zeroOf(base);
		}

		public Object toJani() {
			if (isArray()) {
				Object ret = base.janiName;
				for (int i = 0; i < dimensions; i++) {
					LinkedHashMap<String, Object> t = new LinkedHashMap<>();
					t.put("kind", "array");
					t.put("base", ret);
					ret = t;
				}
				return ret;
			}
			if (minimum == null && maximum == null)
				return base.janiName;
			LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
			ret.put("kind", "bounded");
			ret.put("base", base.janiName);
			if (minimum != null)
				ret.put("lower-bound", minimum);
			if (maximum != null)
				ret.put("upper-bound", maximum);
			return ret;
		}

		public boolean equals(Object other) {
			if (!(other instanceof JaniType))
				return false;
			JaniType o = (JaniType)other;
			return base == o.base && dimensions == o.dimensions
			       && Objects.equals(shape, o.shape)
			       && Objects.equals(minimum, o.minimum)
			       && Objects.equals(maximum, o.maximum);
		}

		public int hashCode() {
			return Objects.hash(base, dimensions, shape, minimum, maximum);
		}

		public String toString() {
			if (shape != null)
				return shape.toString();
			return JSONWriter.toString(toJani());
		}
	}

	public static class JaniVariable {
		public final String name;
		public final JaniType type;
		public final Expression initial;
		public final boolean isTransient;

		/**
		 * @param initial The initial value, or null to start from
		 * the default value of the type.
		 */
		public JaniVariable(String name, JaniType type,
		                    Expression initial, boolean isTransient)
		{
			if (name == null || name.isEmpty())
				throw new InvalidModelException("Variables need a name");
			this.name = name;
			this.type = type;
			this.initial = initial != null ? initial : type.defaultValue();
			this.isTransient = isTransient;
			if (type.base == JaniBaseType.REAL && !isTransient)
				LOG.warn("Variable '{}' is a non-transient real, which some model checkers do not support", name);
		}

		public JaniVariable(String name, JaniType type)
		{
			this(name, type, null, false);
		}

		public JaniVariable withInitial(Expression initial) {
			return new JaniVariable(name, type, initial, isTransient);
		}

		public Map<String, Object> toJani() {
			LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
			ret.put("name", name);
			ret.put("type", type.toJani());
			ret.put("transient", isTransient);
			ret.put("initial-value", initial.toJani());
			return ret;
		}

		public static JaniVariable fromJani(Object o) {
			Map<?, ?> m = JaniUtils.asMap(o, "Variable declaration");
			String name = JaniUtils.getString(m, "name");
			JaniType type = JaniUtils.parseType(m.get("type"));
			Object transO = m.get("transient");
			boolean trans = false;
			if (transO != null) {
				if (!(transO instanceof Boolean))
					throw new IllegalArgumentException("Transient flag of '" + name + "' should be a boolean, not: " + transO);
				trans = (Boolean)transO;
			}
			Object init = m.get("initial-value");
			return new JaniVariable(name, type,
					init == null ? null : Expression.fromJani(init),
					trans);
		}
	}

	public static class JaniConstant {
		public final String name;
		public final JaniType type;
		/** Null for a model parameter. */
		public final Expression value;

		public JaniConstant(String name, JaniType type, Expression value)
		{
			this.name = name;
			this.type = type;
			this.value = value;
		}

		public Map<String, Object> toJani() {
			LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
			ret.put("name", name);
			ret.put("type", type.toJani());
			if (value != null)
				ret.put("value", value.toJani());
			return ret;
		}

		public static JaniConstant fromJani(Object o) {
			Map<?, ?> m = JaniUtils.asMap(o, "Constant declaration");
			Object v = m.get("value");
			return new JaniConstant(JaniUtils.getString(m, "name"),
					JaniUtils.parseType(m.get("type")),
					v == null ? null : Expression.fromJani(v));
		}
	}

	private final String name;
	private final LinkedHashSet<String> features = new LinkedHashSet<>();
	private final LinkedHashMap<String, JaniVariable> globalVars = new LinkedHashMap<>();
	private final LinkedHashMap<String, JaniConstant> constants = new LinkedHashMap<>();
	private final LinkedHashMap<String, Automaton> automata = new LinkedHashMap<>();
	private final ArrayList<Property> properties = new ArrayList<>();
	private Composition composition;

	public JaniModel(String name)
	{
		if (name == null || name.isEmpty())
			throw new InvalidModelException("Models need a name");
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public void addFeature(String feature) {
		features.add(feature);
	}

	public Set<String> getFeatures() {
		return Collections.unmodifiableSet(features);
	}

	public void addVariable(JaniVariable v) {
		if (globalVars.containsKey(v.name))
			throw new InvalidModelException("Duplicate global variable: " + v.name);
		globalVars.put(v.name, v);
	}

	public JaniVariable getVariable(String name) {
		return globalVars.get(name);
	}

	public Collection<JaniVariable> getVariables() {
		return Collections.unmodifiableCollection(globalVars.values());
	}

	/** Replace the declaration of an existing global variable. */
	public void replaceVariable(JaniVariable v) {
		if (!globalVars.containsKey(v.name))
			throw new InvalidModelException("Unknown global variable: " + v.name);
		globalVars.put(v.name, v);
	}

	public void addConstant(JaniConstant c) {
		if (constants.containsKey(c.name))
			throw new InvalidModelException("Duplicate constant: " + c.name);
		constants.put(c.name, c);
	}

	public Collection<JaniConstant> getConstants() {
		return Collections.unmodifiableCollection(constants.values());
	}

	public void addAutomaton(Automaton a) {
		if (automata.containsKey(a.getName()))
			throw new InvalidModelException("Duplicate automaton: " + a.getName());
		if (a.getInitialLocations().isEmpty())
			throw new InvalidModelException("Automaton '" + a.getName() + "' has no initial location");
		automata.put(a.getName(), a);
	}

	public Automaton getAutomaton(String name) {
		return automata.get(name);
	}

	public Collection<Automaton> getAutomata() {
		return Collections.unmodifiableCollection(automata.values());
	}

	public void addProperty(Property p) {
		properties.add(p);
	}

	public List<Property> getProperties() {
		return Collections.unmodifiableList(properties);
	}

	public Composition getComposition() {
		return composition;
	}

	/**
	 * Commit a composition. Every element must be an automaton of
	 * this model, and every action in a sync vector must be the
	 * action of at least one edge of its automaton.
	 */
	public void setComposition(Composition c) {
		if (!c.isValid())
			throw new InvalidModelException("Composition has sync vectors that do not match its elements");
		List<String> elements = c.getElements();
		for (String e : elements) {
			if (!automata.containsKey(e))
				throw new InvalidModelException("Composition refers to unknown automaton: " + e);
		}
		for (Composition.Sync s : c.getSyncs()) {
			for (int i = 0; i < elements.size(); i++) {
				String action = s.vector.get(i);
				if (action == null)
					continue;
				Automaton a = automata.get(elements.get(i));
				if (!a.getActions().contains(action))
					throw new InvalidModelException("Sync '" + s.result + "' uses action '" + action + "' that automaton '" + a.getName() + "' does not have");
			}
		}
		composition = c;
	}

	/**
	 * Remove the edges with the given action from every automaton.
	 *
	 * @return The number of removed edges.
	 */
	public int removeEdgesWithAction(String action) {
		int ret = 0;
		for (Automaton a : automata.values())
			ret += a.removeEdgesWithAction(action);
		return ret;
	}

	/**
	 * Give every action that does not take part in any
	 * synchronization of its automaton a sync of its own, so that
	 * the edge remains enabled in the composition. The sync is named
	 * after the action, prefixed with the automaton name if another
	 * sync already has that name.
	 */
	public void generateMissingSyncs() {
		if (composition == null)
			composition = new Composition();
		for (Automaton a : automata.values()) {
			if (!composition.getElements().contains(a.getName()))
				composition.addElement(a.getName());
			Set<String> synced = composition.getSyncsForElement(a.getName());
			for (String action : a.getActions()) {
				if (synced.contains(action))
					continue;
				String result = action;
				if (composition.hasSync(result))
					result = a.getName() + "_" + action;
				composition.addSync(result, Map.of(a.getName(), action));
			}
		}
	}

	/**
	 * Rewrite the expressions of the model into the subset the model
	 * checkers support: helper operators are lowered and comparisons
	 * between array variables and array values are expanded
	 * element-wise.
	 */
	public void preprocessExpressions() {
		for (JaniVariable v : List.copyOf(globalVars.values()))
			globalVars.put(v.name, v.withInitial(v.initial.lowerHelperOperators()));
		for (Automaton a : automata.values()) {
			final HashMap<String, JaniVariable> scope = new HashMap<>(globalVars);
			scope.putAll(a.getVariables());
			a.transformExpressions(new Function<Expression, Expression>() {
				public Expression apply(Expression e) {
					return lowerArrayComparisons(e.lowerHelperOperators(), scope);
				}
			});
		}
	}

	static Expression lowerArrayComparisons(Expression e, Map<String, JaniVariable> scope) {
		if (!(e instanceof OperatorExpression))
			return e;
		OperatorExpression o = (OperatorExpression)e;
		if (o.op == Operator.EQUALS || o.op == Operator.NOT_EQUALS) {
			Expression l = o.getOperand("left"), r = o.getOperand("right");
			Expression cmp = null;
			if (l instanceof VariableExpression && r instanceof ArrayValueExpression)
				cmp = compareArray((VariableExpression)l, (ArrayValueExpression)r, scope);
			else if (r instanceof VariableExpression && l instanceof ArrayValueExpression)
				cmp = compareArray((VariableExpression)r, (ArrayValueExpression)l, scope);
			if (cmp != null) {
				if (o.op == Operator.NOT_EQUALS)
					return OperatorExpression.unary(Operator.NOT, cmp);
				return cmp;
			}
		}
		LinkedHashMap<String, Expression> operands = new LinkedHashMap<>();
		boolean changed = false;
		for (Map.Entry<String, Expression> op : o.getOperands().entrySet()) {
			Expression n = lowerArrayComparisons(op.getValue(), scope);
			changed |= n != op.getValue();
			operands.put(op.getKey(), n);
		}
		return changed ? new OperatorExpression(o.op, operands) : o;
	}

	private static Expression compareArray(VariableExpression array, ArrayValueExpression value, Map<String, JaniVariable> scope) {
		JaniVariable v = scope.get(array.variable);
		if (v == null || !v.type.isArray())
			throw new InvalidModelException("'" + array.variable + "' is compared to an array value but is not an array variable");
		String length = array.variable + LENGTH_SUFFIX;
		if (!scope.containsKey(length))
			throw new InvalidModelException("Array '" + array.variable + "' has no length variable '" + length + "'");
		Expression ret = OperatorExpression.binary(Operator.EQUALS,
				new VariableExpression(length),
				new ConstantExpression((long)value.elements.size()));
		for (int i = 0; i < value.elements.size(); i++) {
			Expression elem = OperatorExpression.binary(Operator.EQUALS,
					OperatorExpression.arrayAccess(array, new ConstantExpression((long)i)),
					value.elements.get(i));
			ret = OperatorExpression.binary(Operator.AND, ret, elem);
		}
		return ret;
	}

	public Map<String, Object> toJani() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("jani-version", JANI_VERSION);
		ret.put("name", name);
		ret.put("type", MODEL_TYPE);
		ret.put("metadata", Map.of("description", "Autogenerated with janigen"));
		ret.put("features", new ArrayList<>(features));
		TreeSet<String> actions = new TreeSet<>();
		for (Automaton a : automata.values())
			actions.addAll(a.getActions());
		if (composition != null) {
			for (Composition.Sync s : composition.getSyncs())
				actions.add(s.result);
		}
		ArrayList<Object> actionList = new ArrayList<>();
		for (String a : actions)
			actionList.add(Map.of("name", a));
		ret.put("actions", actionList);
		ArrayList<Object> vars = new ArrayList<>();
		for (JaniVariable v : globalVars.values())
			vars.add(v.toJani());
		ret.put("variables", vars);
		ArrayList<Object> consts = new ArrayList<>();
		for (JaniConstant c : constants.values())
			consts.add(c.toJani());
		ret.put("constants", consts);
		ArrayList<Object> auts = new ArrayList<>();
		for (Automaton a : automata.values())
			auts.add(a.toJani());
		ret.put("automata", auts);
		Composition c = composition;
		if (c == null) {
			c = new Composition();
			for (String a : automata.keySet())
				c.addElement(a);
		}
		ret.put("system", c.toJani());
		ArrayList<Object> props = new ArrayList<>();
		for (Property p : properties)
			props.add(p.toJani());
		ret.put("properties", props);
		return ret;
	}

	public void writeJani(PrintStream out) {
		JSONWriter.write(toJani(), out);
	}

	public static JaniModel fromJani(Object jani) {
		Map<?, ?> root = JaniUtils.asMap(jani, "JANI model");
		Object janiVers = root.get("jani-version");
		if (!Long.valueOf(JANI_VERSION).equals(janiVers))
			LOG.warn("JANI version {} may not be supported", janiVers);
		Object type = root.get("type");
		if (type != null && !MODEL_TYPE.equals(type))
			throw new IllegalArgumentException("Only " + MODEL_TYPE + " models are supported, not: " + type);
		Object nameO = root.get("name");
		JaniModel ret = new JaniModel(nameO == null ? ConversionOptions.DEFAULT_MODEL_NAME : nameO.toString());
		for (Object f : JaniUtils.getList(root, "features"))
			ret.addFeature(f.toString());
		for (Object c : JaniUtils.getList(root, "constants"))
			ret.addConstant(JaniConstant.fromJani(c));
		for (Object v : JaniUtils.getList(root, "variables"))
			ret.addVariable(JaniVariable.fromJani(v));
		for (Object a : JaniUtils.getList(root, "automata"))
			ret.addAutomaton(Automaton.fromJani(a));
		Object system = root.get("system");
		if (system != null)
			ret.setComposition(Composition.fromJani(system));
		for (Object p : JaniUtils.getList(root, "properties"))
			ret.addProperty(Property.fromJani(p));
		return ret;
	}

	public static JaniModel readJaniFile(String filename) throws IOException {
		return fromJani(JSONParser.readJsonFromFile(filename));
	}
}
