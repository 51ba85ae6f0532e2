package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static nl.utwente.ewi.fmt.JANIGEN.expression.Operator.*;

/** Application of an {@link Operator} to its named operands. */
public class OperatorExpression extends Expression
{
	public final Operator op;
	private final Map<String, Expression> operands;
	private final Set<String> variables;

	public OperatorExpression(Operator op, Map<String, Expression> operands)
	{
		this.op = op;
		LinkedHashMap<String, Expression> ordered = new LinkedHashMap<>();
		for (String role : op.operands) {
			Expression e = operands.get(role);
			if (e == null)
				throw new IllegalArgumentException("Operator '" + op.symbol + "' requires operand '" + role + "'");
			ordered.put(role, e);
		}
		if (operands.size() != ordered.size())
			throw new IllegalArgumentException("Unexpected operands for '" + op.symbol + "': " + operands.keySet());
		if (op == ARRAY_CREATE && !(ordered.get("var") instanceof VariableExpression))
			throw new IllegalArgumentException("Array iterator should be an identifier, not: " + ordered.get("var"));
		this.operands = Collections.unmodifiableMap(ordered);
		TreeSet<String> vs = new TreeSet<>();
		for (Expression e : ordered.values())
			vs.addAll(e.getReferencedVariables());
		if (op == ARRAY_CREATE)
			vs.remove(getIterator());
		variables = Set.copyOf(vs);
	}

	public static OperatorExpression binary(Operator op, Expression left, Expression right) {
		LinkedHashMap<String, Expression> ops = new LinkedHashMap<>();
		ops.put("left", left);
		ops.put("right", right);
		return new OperatorExpression(op, ops);
	}

	public static OperatorExpression unary(Operator op, Expression exp) {
		return new OperatorExpression(op, Map.of("exp", exp));
	}

	public static OperatorExpression ite(Expression cond, Expression thenExpr, Expression elseExpr) {
		return new OperatorExpression(ITE, Map.of("if", cond, "then", thenExpr, "else", elseExpr));
	}

	public static OperatorExpression arrayAccess(Expression array, Expression index) {
		return new OperatorExpression(ARRAY_ACCESS, Map.of("exp", array, "index", index));
	}

	public static OperatorExpression arrayCreate(String iterator, Expression length, Expression fill) {
		return new OperatorExpression(ARRAY_CREATE,
				Map.of("var", new VariableExpression(iterator), "length", length, "exp", fill));
	}

	public Expression getOperand(String role) {
		return operands.get(role);
	}

	public Map<String, Expression> getOperands() {
		return operands;
	}

	private String getIterator() {
		return ((VariableExpression)operands.get("var")).variable;
	}

	public Set<String> getReferencedVariables() {
		return variables;
	}

	private Number number(Object v) {
		if (v == null || v instanceof Number)
			return (Number)v;
		throw new IllegalArgumentException("Operator '" + op.symbol + "' expects a number, found: " + v);
	}

	private Boolean bool(Object v) {
		if (v == null || v instanceof Boolean)
			return (Boolean)v;
		throw new IllegalArgumentException("Operator '" + op.symbol + "' expects a boolean, found: " + v);
	}

	private static boolean valuesEqual(Object l, Object r) {
		if (l instanceof Long && r instanceof Long)
			return ((Long)l).longValue() == ((Long)r).longValue();
		if (l instanceof Number && r instanceof Number)
			return ((Number)l).doubleValue() == ((Number)r).doubleValue();
		return l.equals(r);
	}

	public Object evaluate(Map<String, ?> valuation) {
		switch (op) {
		case AND:
		case OR:
		case IMPLIES:
			return evaluateLogic(valuation);
		case NOT: {
			Boolean b = bool(operands.get("exp").evaluate(valuation));
			return b == null ? null : !b;
		}
		case ITE: {
			Boolean cond = bool(operands.get("if").evaluate(valuation));
			if (cond == null)
				return null;
			return operands.get(cond ? "then" : "else").evaluate(valuation);
		}
		case EQUALS:
		case NOT_EQUALS: {
			Object l = operands.get("left").evaluate(valuation);
			Object r = operands.get("right").evaluate(valuation);
			if (l == null || r == null)
				return null;
			return valuesEqual(l, r) == (op == EQUALS);
		}
		case ARRAY_CREATE:
			return evaluateArrayCreate(valuation);
		case ARRAY_ACCESS:
			return evaluateArrayAccess(valuation);
		default:
			break;
		}
		if (op.isHelper())
			return lowerHelperOperators().evaluate(valuation);
		if (op.operands.size() == 1) {
			Number v = number(operands.get("exp").evaluate(valuation));
			return v == null ? null : evaluateUnary(v);
		}
		Number l = number(operands.get("left").evaluate(valuation));
		Number r = number(operands.get("right").evaluate(valuation));
		if (l == null || r == null)
			return null;
		return evaluateBinary(l, r);
	}

	private Object evaluateLogic(Map<String, ?> valuation) {
		Boolean l = bool(operands.get("left").evaluate(valuation));
		Boolean r = bool(operands.get("right").evaluate(valuation));
		switch (op) {
		case AND:
			if (Boolean.FALSE.equals(l) || Boolean.FALSE.equals(r))
				return false;
			return (l == null || r == null) ? null : true;
		case OR:
			if (Boolean.TRUE.equals(l) || Boolean.TRUE.equals(r))
				return true;
			return (l == null || r == null) ? null : false;
		default:
			if (Boolean.FALSE.equals(l) || Boolean.TRUE.equals(r))
				return true;
			return (l == null || r == null) ? null : false;
		}
	}

	private Object evaluateUnary(Number v) {
		boolean integral = v instanceof Long;
		switch (op) {
		case SIN:
			return Math.sin(v.doubleValue());
		case COS:
			return Math.cos(v.doubleValue());
		case FLOOR:
			return integral ? v : (Object)(long)Math.floor(v.doubleValue());
		case CEIL:
			return integral ? v : (Object)(long)Math.ceil(v.doubleValue());
		case ABS:
			return integral ? (Object)Math.abs(v.longValue()) : (Object)Math.abs(v.doubleValue());
		default:
			throw new UnsupportedOperationException("Unknown unary operator: " + op.symbol);
		}
	}

	private Object evaluateBinary(Number l, Number r) {
		boolean integral = (l instanceof Long) && (r instanceof Long);
		long lL = l.longValue(), rL = r.longValue();
		double lD = l.doubleValue(), rD = r.doubleValue();
		switch (op) {
		case LESS:
			return integral ? lL < rL : lD < rD;
		case LESS_OR_EQUAL:
			return integral ? lL <= rL : lD <= rD;
		case GREATER:
			return integral ? lL > rL : lD > rD;
		case GREATER_OR_EQUAL:
			return integral ? lL >= rL : lD >= rD;
		case ADD:
			return integral ? (Object)(lL + rL) : (Object)(lD + rD);
		case SUBTRACT:
			return integral ? (Object)(lL - rL) : (Object)(lD - rD);
		case MULTIPLY:
			return integral ? (Object)(lL * rL) : (Object)(lD * rD);
		case MODULO:
			if (integral && rL == 0)
				throw new ArithmeticException("Modulo by zero in " + this);
			return integral ? (Object)(lL % rL) : (Object)(lD % rD);
		case MIN:
			return integral ? (Object)Math.min(lL, rL) : (Object)Math.min(lD, rD);
		case MAX:
			return integral ? (Object)Math.max(lL, rL) : (Object)Math.max(lD, rD);
		case DIVIDE:
			return lD / rD;
		case POW:
			return Math.pow(lD, rD);
		case LOG:
			return Math.log(lD) / Math.log(rD);
		default:
			throw new UnsupportedOperationException("Unknown binary operator: " + op.symbol);
		}
	}

	private Object evaluateArrayCreate(Map<String, ?> valuation) {
		Number length = number(operands.get("length").evaluate(valuation));
		if (length == null)
			return null;
		if (!(length instanceof Long) || length.longValue() < 0)
			throw new IllegalArgumentException("Array length should be a non-negative integer, not: " + length);
		HashMap<String, Object> inner = new HashMap<String, Object>(valuation);
		ArrayList<Object> ret = new ArrayList<>();
		for (long i = 0; i < length.longValue(); i++) {
			inner.put(getIterator(), i);
			Object v = operands.get("exp").evaluate(inner);
			if (v == null)
				return null;
			ret.add(v);
		}
		return ret;
	}

	private Object evaluateArrayAccess(Map<String, ?> valuation) {
		Object array = operands.get("exp").evaluate(valuation);
		Number index = number(operands.get("index").evaluate(valuation));
		if (array == null || index == null)
			return null;
		if (!(array instanceof List))
			throw new IllegalArgumentException("Array access on non-array value: " + array);
		if (!(index instanceof Long))
			throw new IllegalArgumentException("Array index should be an integer, not: " + index);
		List<?> l = (List<?>)array;
		long i = index.longValue();
		if (i < 0 || i >= l.size())
			throw new IllegalArgumentException("Array index " + i + " out of bounds for length " + l.size());
		return l.get((int)i);
	}

	public Object toJani() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("op", op.symbol);
		for (Map.Entry<String, Expression> e : operands.entrySet())
			ret.put(e.getKey(), e.getValue().toJani());
		return ret;
	}

	public OperatorExpression renameVars(Map<String, String> renames) {
		LinkedHashMap<String, Expression> renamed = new LinkedHashMap<>();
		Map<String, String> inner = renames;
		if (op == ARRAY_CREATE && renames.containsKey(getIterator())) {
			HashMap<String, String> r = new HashMap<>(renames);
			r.remove(getIterator());
			inner = r;
		}
		for (Map.Entry<String, Expression> e : operands.entrySet()) {
			if (op == ARRAY_CREATE && e.getKey().equals("var"))
				renamed.put(e.getKey(), e.getValue());
			else if (op == ARRAY_CREATE && e.getKey().equals("exp"))
				renamed.put(e.getKey(), e.getValue().renameVars(inner));
			else
				renamed.put(e.getKey(), e.getValue().renameVars(renames));
		}
		return new OperatorExpression(op, renamed);
	}

	private static Expression round(Expression e) {
		return unary(FLOOR, binary(ADD, e, new ConstantExpression(0.5)));
	}

	public Expression lowerHelperOperators() {
		LinkedHashMap<String, Expression> lowered = new LinkedHashMap<>();
		boolean changed = false;
		for (Map.Entry<String, Expression> e : operands.entrySet()) {
			Expression l = e.getValue().lowerHelperOperators();
			changed |= l != e.getValue();
			lowered.put(e.getKey(), l);
		}
		Expression exp = lowered.get("exp");
		switch (op) {
		case NORM2D: {
			Expression x = lowered.get("x"), y = lowered.get("y");
			return binary(POW,
			              binary(ADD, binary(MULTIPLY, x, x), binary(MULTIPLY, y, y)),
			              new ConstantExpression(0.5));
		}
		case DOT2D:
			return binary(ADD,
			              binary(MULTIPLY, lowered.get("x1"), lowered.get("x2")),
			              binary(MULTIPLY, lowered.get("y1"), lowered.get("y2")));
		case CROSS2D:
			return binary(SUBTRACT,
			              binary(MULTIPLY, lowered.get("x1"), lowered.get("y2")),
			              binary(MULTIPLY, lowered.get("y1"), lowered.get("x2")));
		case ROUND:
			return round(exp);
		case TO_CM:
			return round(binary(MULTIPLY, exp, new ConstantExpression(100.0)));
		case TO_M:
			return binary(MULTIPLY, exp, new ConstantExpression(0.01));
		case TO_DEG:
			return binary(MODULO,
			              round(binary(MULTIPLY, exp, new ConstantExpression(180.0 / Math.PI))),
			              new ConstantExpression(360L));
		case TO_RAD:
			return binary(MULTIPLY, exp, new ConstantExpression(Math.PI / 180.0));
		default:
			return changed ? new OperatorExpression(op, lowered) : this;
		}
	}

	public boolean containsDistribution() {
		for (Expression e : operands.values()) {
			if (e.containsDistribution())
				return true;
		}
		return false;
	}

	/* Operands are combined in table order; the last operand varies
	 * fastest. */
	public List<Expression> expandDistributions(int options) {
		if (!containsDistribution())
			return List.of(this);
		List<Map<String, Expression>> combinations = List.of(Map.of());
		for (Map.Entry<String, Expression> e : operands.entrySet()) {
			List<Expression> variants = e.getValue().expandDistributions(options);
			ArrayList<Map<String, Expression>> next = new ArrayList<>();
			for (Map<String, Expression> base : combinations) {
				for (Expression v : variants) {
					LinkedHashMap<String, Expression> c = new LinkedHashMap<>(base);
					c.put(e.getKey(), v);
					next.add(c);
				}
			}
			combinations = next;
		}
		ArrayList<Expression> ret = new ArrayList<>(combinations.size());
		for (Map<String, Expression> c : combinations)
			ret.add(new OperatorExpression(op, c));
		return ret;
	}
}
