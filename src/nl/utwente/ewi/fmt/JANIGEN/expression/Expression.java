package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import nl.ennoruijters.util.JSONWriter;

/**
 * Node of the expression AST. An expression is a literal value
 * ({@link ConstantExpression}), an identifier
 * ({@link VariableExpression}) or an operator application
 * ({@link OperatorExpression}, {@link ArrayValueExpression},
 * {@link DistributionExpression}).
 */
public abstract class Expression
{
	/** Get the set of variables that must be included in the
	 * valuation for the expression to be fully evaluated.
	 */
	public Set<String> getReferencedVariables() {
		return Set.of();
	}

	/**
	 * Evaluate the expression under the given valuation.
	 *
	 * @return A Boolean, Long, Double or List of those, or null if
	 * the value depends on variables not in the valuation.
	 */
	public abstract Object evaluate(Map<String, ?> valuation);

	/** The dictionary form of this expression, as written to JANI. */
	public abstract Object toJani();

	public abstract Expression renameVars(Map<String, String> renames);

	/**
	 * Rewrite the 2D-geometry and unit-conversion helper operators
	 * into plain JANI operators.
	 */
	public Expression lowerHelperOperators() {
		return this;
	}

	public boolean containsDistribution() {
		return false;
	}

	/**
	 * Replace every distribution in this expression by its
	 * discretized values.
	 *
	 * @param options The number of values each distribution is
	 * split into.
	 * @return One expression per combination of discretized values;
	 * just this expression if it contains no distribution.
	 */
	public List<Expression> expandDistributions(int options) {
		return List.of(this);
	}

	public static Expression fromJani(Object o)
	{
		if (o == null)
			throw new IllegalArgumentException("Expression should not be null");
		if (o instanceof Boolean)
			return new ConstantExpression(o);
		if (o instanceof Number)
			return new ConstantExpression(o);
		if (o instanceof String)
			return new VariableExpression((String)o);
		if (!(o instanceof Map))
			throw new IllegalArgumentException("Expression should be literal, identifier or object, not: " + o);
		Map<?, ?> e = (Map<?, ?>)o;
		if (e.containsKey("constant"))
			return ConstantExpression.fromSymbol(e.get("constant"));
		if (e.containsKey("distribution")) {
			Object args = e.get("args");
			if (!(args instanceof List))
				throw new IllegalArgumentException("Distribution arguments should be an array, not: " + args);
			return new DistributionExpression(String.valueOf(e.get("distribution")), fromJaniList((List<?>)args));
		}
		Object op = e.get("op");
		if (!(op instanceof String))
			throw new IllegalArgumentException("Operator: " + op + " in " + o + " should be string");
		if (ArrayValueExpression.SYMBOL.equals(op)) {
			Object elements = e.get("elements");
			if (!(elements instanceof List))
				throw new IllegalArgumentException("Array value elements should be an array, not: " + elements);
			return new ArrayValueExpression(fromJaniList((List<?>)elements));
		}
		Operator operator = Operator.fromSymbol((String)op);
		if (operator == null)
			throw new UnsupportedOperationException("Unknown operator '" + op + "' in expression: " + o);
		for (Object key : e.keySet()) {
			if (!"op".equals(key) && !operator.operands.contains(key))
				throw new IllegalArgumentException("Operator '" + op + "' has no operand '" + key + "'");
		}
		LinkedHashMap<String, Expression> operands = new LinkedHashMap<>();
		for (String role : operator.operands) {
			if (!e.containsKey(role))
				throw new IllegalArgumentException("Operator '" + op + "' is missing operand '" + role + "' in: " + o);
			operands.put(role, fromJani(e.get(role)));
		}
		return new OperatorExpression(operator, operands);
	}

	private static List<Expression> fromJaniList(List<?> l) {
		ArrayList<Expression> ret = new ArrayList<>(l.size());
		for (Object o : l)
			ret.add(fromJani(o));
		return ret;
	}

	@Override
	public int hashCode() {
		return toJani().hashCode();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Expression))
			return false;
		return toJani().equals(((Expression)other).toJani());
	}

	@Override
	public String toString() {
		return JSONWriter.toString(toJani());
	}
}
