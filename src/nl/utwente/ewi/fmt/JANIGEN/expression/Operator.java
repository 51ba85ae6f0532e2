package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The operators an {@link OperatorExpression} may apply, with the
 * operand names each of them requires.
 */
public enum Operator {
	AND("∧", "left", "right"),
	OR("∨", "left", "right"),
	IMPLIES("⇒", "left", "right"),
	EQUALS("=", "left", "right"),
	NOT_EQUALS("≠", "left", "right"),
	LESS("<", "left", "right"),
	LESS_OR_EQUAL("≤", "left", "right"),
	GREATER(">", "left", "right"),
	GREATER_OR_EQUAL("≥", "left", "right"),
	ADD("+", "left", "right"),
	SUBTRACT("-", "left", "right"),
	MULTIPLY("*", "left", "right"),
	DIVIDE("/", "left", "right"),
	MODULO("%", "left", "right"),
	POW("pow", "left", "right"),
	LOG("log", "left", "right"),
	MIN("min", "left", "right"),
	MAX("max", "left", "right"),

	NOT("¬", "exp"),
	SIN("sin", "exp"),
	COS("cos", "exp"),
	FLOOR("floor", "exp"),
	CEIL("ceil", "exp"),
	ABS("abs", "exp"),
	ROUND("round", "exp"),
	TO_CM("to_cm", "exp"),
	TO_M("to_m", "exp"),
	TO_DEG("to_deg", "exp"),
	TO_RAD("to_rad", "exp"),

	ITE("ite", "if", "then", "else"),
	ARRAY_CREATE("ac", "var", "length", "exp"),
	ARRAY_ACCESS("aa", "exp", "index"),

	NORM2D("norm2d", "x", "y"),
	DOT2D("dot2d", "x1", "y1", "x2", "y2"),
	CROSS2D("cross2d", "x1", "y1", "x2", "y2"),
	;

	private static final Map<String, String> ALIASES = Map.of(
			"&&", "∧", "and", "∧",
			"||", "∨", "or", "∨",
			"=>", "⇒",
			"==", "=",
			"!=", "≠",
			"<=", "≤",
			">=", "≥",
			"!", "¬");
	private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();
	static {
		for (Operator op : values())
			BY_SYMBOL.put(op.symbol, op);
	}

	public final String symbol;
	/** Operand names, in the order distributions are expanded. */
	public final List<String> operands;

	Operator(String symbol, String... operands) {
		this.symbol = symbol;
		this.operands = List.of(operands);
	}

	/**
	 * Look up an operator by its JANI symbol or one of the accepted
	 * spellings ({@code &&}, {@code ==}, ...).
	 *
	 * @return The operator, or null if the symbol is unknown.
	 */
	public static Operator fromSymbol(String symbol) {
		String normalized = ALIASES.get(symbol);
		if (normalized != null)
			symbol = normalized;
		return BY_SYMBOL.get(symbol);
	}

	public boolean isHelper() {
		switch (this) {
		case ROUND:
		case TO_CM:
		case TO_M:
		case TO_DEG:
		case TO_RAD:
		case NORM2D:
		case DOT2D:
		case CROSS2D:
			return true;
		default:
			return false;
		}
	}
}
