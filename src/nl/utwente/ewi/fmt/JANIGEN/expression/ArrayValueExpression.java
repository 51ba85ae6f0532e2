package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Array literal with a fixed number of elements ({@code av}). */
public class ArrayValueExpression extends Expression
{
	public static final String SYMBOL = "av";

	public final List<Expression> elements;
	private final Set<String> variables;

	public ArrayValueExpression(List<Expression> elements)
	{
		this.elements = List.copyOf(elements);
		TreeSet<String> vs = new TreeSet<>();
		for (Expression e : elements)
			vs.addAll(e.getReferencedVariables());
		variables = Set.copyOf(vs);
	}

	public Set<String> getReferencedVariables() {
		return variables;
	}

	public Object evaluate(Map<String, ?> valuation) {
		ArrayList<Object> ret = new ArrayList<>(elements.size());
		for (Expression e : elements) {
			Object v = e.evaluate(valuation);
			if (v == null)
				return null;
			ret.add(v);
		}
		return ret;
	}

	public Object toJani() {
		ArrayList<Object> elems = new ArrayList<>(elements.size());
		for (Expression e : elements)
			elems.add(e.toJani());
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("op", SYMBOL);
		ret.put("elements", elems);
		return ret;
	}

	public ArrayValueExpression renameVars(Map<String, String> renames) {
		ArrayList<Expression> renamed = new ArrayList<>(elements.size());
		for (Expression e : elements)
			renamed.add(e.renameVars(renames));
		return new ArrayValueExpression(renamed);
	}

	public Expression lowerHelperOperators() {
		ArrayList<Expression> lowered = new ArrayList<>(elements.size());
		boolean changed = false;
		for (Expression e : elements) {
			Expression l = e.lowerHelperOperators();
			changed |= l != e;
			lowered.add(l);
		}
		return changed ? new ArrayValueExpression(lowered) : this;
	}

	public boolean containsDistribution() {
		for (Expression e : elements) {
			if (e.containsDistribution())
				return true;
		}
		return false;
	}

	public List<Expression> expandDistributions(int options) {
		if (!containsDistribution())
			return List.of(this);
		List<List<Expression>> combinations = List.of(List.of());
		for (Expression e : elements) {
			List<Expression> variants = e.expandDistributions(options);
			ArrayList<List<Expression>> next = new ArrayList<>();
			for (List<Expression> base : combinations) {
				for (Expression v : variants) {
					ArrayList<Expression> c = new ArrayList<>(base);
					c.add(v);
					next.add(c);
				}
			}
			combinations = next;
		}
		ArrayList<Expression> ret = new ArrayList<>(combinations.size());
		for (List<Expression> c : combinations)
			ret.add(new ArrayValueExpression(c));
		return ret;
	}
}
