package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.Map;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;

public class ConstantExpression extends Expression
{
	public final static ConstantExpression TRUE = new ConstantExpression(Boolean.TRUE);
	public final static ConstantExpression FALSE = new ConstantExpression(Boolean.FALSE);
	public final static ConstantExpression E = new ConstantExpression("e", Math.E);
	public final static ConstantExpression PI = new ConstantExpression("π", Math.PI);

	/** Boolean, Long or Double. */
	public final Object value;
	/** Name of a mathematical constant, null for plain literals. */
	public final String symbol;

	public ConstantExpression(Object val) {
		if (val instanceof Integer || val instanceof Short || val instanceof Byte)
			val = ((Number)val).longValue();
		else if (val instanceof Float)
			val = ((Float)val).doubleValue();
		if (!(val instanceof Boolean) && !(val instanceof Long) && !(val instanceof Double))
			throw new IllegalArgumentException("Literal should be boolean, integer or real, not: " + val);
		value = val;
		symbol = null;
	}

	private ConstantExpression(String symbol, double val) {
		this.value = val;
		this.symbol = symbol;
	}

	static ConstantExpression fromSymbol(Object symbol) {
		if (E.symbol.equals(symbol))
			return E;
		if (PI.symbol.equals(symbol))
			return PI;
		throw new UnsupportedOperationException("Unknown constant value: " + symbol);
	}

	/** The literal of the given type that arrays of that type are filled with. */
	public static ConstantExpression zeroOf(JaniBaseType type) {
		switch (type) {
		case BOOLEAN:
			return FALSE;
		case INTEGER:
			return new ConstantExpression(0L);
		case REAL:
			return new ConstantExpression(0.0);
		default:
			throw new AssertionError("Unknown base type: " + type);
		}
	}

	public boolean isNumber() {
		return value instanceof Number;
	}

	public Object evaluate(Map<String, ?> valuation) {
		return value;
	}

	public Object toJani() {
		if (symbol != null)
			return Map.of("constant", symbol);
		return value;
	}

	public ConstantExpression renameVars(Map<String, String> renames) {
		return this;
	}

	public String toString() {
		if (symbol != null)
			return symbol;
		return value.toString();
	}
}
