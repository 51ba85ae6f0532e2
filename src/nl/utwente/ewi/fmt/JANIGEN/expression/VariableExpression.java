package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.Map;
import java.util.Set;

/**
 * Reference to a variable, constant or event payload field. Dotted
 * names such as {@code level.data} are kept as a single identifier.
 */
public class VariableExpression extends Expression
{
	public final String variable;

	public VariableExpression(String var) {
		if (var == null || var.isEmpty())
			throw new IllegalArgumentException("Identifier should be a non-empty string, not: " + var);
		variable = var;
	}

	public Set<String> getReferencedVariables() {
		return Set.of(variable);
	}

	public Object evaluate(Map<String, ?> valuation) {
		return valuation.get(variable);
	}

	public Object toJani() {
		return variable;
	}

	public VariableExpression renameVars(Map<String, String> renames) {
		String renamed = renames.get(variable);
		if (renamed == null)
			return this;
		return new VariableExpression(renamed);
	}

	public String toString() {
		return variable;
	}
}
