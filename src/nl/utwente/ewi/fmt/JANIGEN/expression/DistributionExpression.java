package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A random value drawn from a statistical distribution. The target
 * model cannot express these directly: they are replaced by a finite
 * set of equally likely values before the model is written.
 */
public class DistributionExpression extends Expression
{
	public static final String UNIFORM = "Uniform";

	public final String distribution;
	public final List<Expression> args;
	private final Set<String> variables;

	public DistributionExpression(String distribution, List<Expression> args)
	{
		if (!UNIFORM.equals(distribution))
			throw new UnsupportedOperationException("Unsupported distribution: " + distribution);
		if (args.size() != 2)
			throw new IllegalArgumentException("Uniform distribution takes 2 arguments, not " + args.size());
		this.distribution = distribution;
		this.args = List.copyOf(args);
		Object lower = args.get(0).evaluate(Map.of());
		Object upper = args.get(1).evaluate(Map.of());
		if (lower instanceof Number && upper instanceof Number
		    && ((Number)lower).doubleValue() > ((Number)upper).doubleValue())
		{
			throw new IllegalArgumentException("Uniform distribution lower bound " + lower + " exceeds upper bound " + upper);
		}
		TreeSet<String> vs = new TreeSet<>();
		for (Expression e : args)
			vs.addAll(e.getReferencedVariables());
		variables = Set.copyOf(vs);
	}

	public static DistributionExpression uniform(double lower, double upper) {
		return new DistributionExpression(UNIFORM,
				List.of(new ConstantExpression(lower), new ConstantExpression(upper)));
	}

	public Set<String> getReferencedVariables() {
		return variables;
	}

	/** Random values have no single value. */
	public Object evaluate(Map<String, ?> valuation) {
		return null;
	}

	public Object toJani() {
		ArrayList<Object> a = new ArrayList<>(args.size());
		for (Expression e : args)
			a.add(e.toJani());
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("distribution", distribution);
		ret.put("args", a);
		return ret;
	}

	public DistributionExpression renameVars(Map<String, String> renames) {
		ArrayList<Expression> renamed = new ArrayList<>(args.size());
		for (Expression e : args)
			renamed.add(e.renameVars(renames));
		return new DistributionExpression(distribution, renamed);
	}

	public boolean containsDistribution() {
		return true;
	}

	private double constantBound(int i) {
		Object v = args.get(i).evaluate(Map.of());
		if (!(v instanceof Number))
			throw new UnsupportedOperationException("Distribution bounds must be constant, not: " + args.get(i));
		return ((Number)v).doubleValue();
	}

	/**
	 * Split the range into {@code options} steps of equal width and
	 * return the lower end of each step.
	 */
	public List<Expression> expandDistributions(int options) {
		if (options <= 0)
			throw new IllegalArgumentException("Number of distribution options should be positive, not: " + options);
		double lower = constantBound(0);
		double width = constantBound(1) - lower;
		ArrayList<Expression> ret = new ArrayList<>(options);
		for (int i = 0; i < options; i++)
			ret.add(new ConstantExpression(lower + (i * width / options)));
		return ret;
	}
}
