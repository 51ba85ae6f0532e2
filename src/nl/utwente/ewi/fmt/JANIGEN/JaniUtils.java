package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.expression.ArrayInfo;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;

class JaniUtils {
	/* Type tags of the state-machine front end, e.g. "int32",
	 * "float64[]" or "bool[10][3]". */
	private static final Pattern TYPE_TAG = Pattern.compile("([a-z]+)(8|16|32|64)?((?:\\[[0-9]*\\])*)");
	private static final Pattern DIMENSION = Pattern.compile("\\[([0-9]*)\\]");

	public static int safeToInteger(Number num) {
		if (num instanceof Integer)
			return (Integer)num;
		if (num instanceof Long)
			return Math.toIntExact((Long)num);
		if ((num instanceof Float) || (num instanceof Double)) {
			double d = num.doubleValue();
			if (Math.floor(d) != d)
				throw new ArithmeticException(d + " cannot be exactly converted to an integer");
			if (d > Integer.MAX_VALUE || d < Integer.MIN_VALUE)
				throw new ArithmeticException(d + " is too big to be exactly converted to an integer");
			return (int)d;
		}
		throw new UnsupportedOperationException("Cannot convert type " + num.getClass() + " to integer");
	}

	static Map<?, ?> asMap(Object o, String what) {
		if (!(o instanceof Map))
			throw new IllegalArgumentException(what + " should be an object, not: " + o);
		return (Map<?, ?>)o;
	}

	static String getString(Map<?, ?> m, String key) {
		Object o = m.get(key);
		if (!(o instanceof String))
			throw new IllegalArgumentException("'" + key + "' should be a string, not: " + o);
		return (String)o;
	}

	/** The list under the given key, or an empty list if absent. */
	static List<?> getList(Map<?, ?> m, String key) {
		Object o = m.get(key);
		if (o == null)
			return Collections.emptyList();
		if (!(o instanceof List))
			throw new IllegalArgumentException("'" + key + "' should be an array, not: " + o);
		return (List<?>)o;
	}

	/** Parse a type as it appears in a JANI file. */
	public static JaniType parseType(Object t)
	{
		if (t instanceof String)
			return JaniType.of(JaniBaseType.fromJaniName(t));
		Map<?, ?> tm = asMap(t, "Type");
		Object kind = tm.get("kind");
		if ("array".equals(kind)) {
			JaniType base = parseType(tm.get("base"));
			if (base.minimum != null || base.maximum != null)
				throw new UnsupportedOperationException("Arrays of bounded types are not supported");
			return JaniType.array(base.base, base.dimensions + 1);
		}
		if (!"bounded".equals(kind))
			throw new IllegalArgumentException("Type kind should be 'array' or 'bounded', not: " + kind);
		JaniBaseType base = JaniBaseType.fromJaniName(tm.get("base"));
		return JaniType.bounded(base, getBound(tm, "lower-bound"),
		                        getBound(tm, "upper-bound"));
	}

	private static Number getBound(Map<?, ?> tm, String key) {
		Object b = tm.get(key);
		if (b == null)
			return null;
		Object v = Expression.fromJani(b).evaluate(Map.of());
		if (!(v instanceof Number))
			throw new IllegalArgumentException("'" + key + "' should be a constant number, not: " + b);
		return (Number)v;
	}

	/**
	 * Parse a type tag of a state-machine declaration.
	 *
	 * @param tag The type, e.g. "bool", "int32", "float64[]",
	 * "uint8[5]".
	 * @param defaultMaxSize The maximum size of array dimensions
	 * that do not declare one.
	 */
	public static JaniType parseTypeTag(String tag, int defaultMaxSize)
	{
		Matcher m = TYPE_TAG.matcher(tag.trim());
		if (!m.matches())
			throw new IllegalArgumentException("Unknown type: " + tag);
		String name = m.group(1);
		boolean sized = m.group(2) != null;
		JaniBaseType base;
		switch (name) {
		case "bool":
		case "boolean":
			base = JaniBaseType.BOOLEAN;
			sized = !sized;
			break;
		case "int":
		case "uint":
			base = JaniBaseType.INTEGER;
			sized = true;
			break;
		case "float":
			base = JaniBaseType.REAL;
			break;
		case "double":
		case "real":
			base = JaniBaseType.REAL;
			sized = !sized;
			break;
		default:
			base = null;
		}
		if (base == null || !sized)
			throw new IllegalArgumentException("Unknown type: " + tag);
		String dims = m.group(3);
		if (dims.isEmpty())
			return JaniType.of(base);
		ArrayList<Integer> sizes = new ArrayList<>();
		Matcher d = DIMENSION.matcher(dims);
		while (d.find()) {
			String size = d.group(1);
			int s = size.isEmpty() ? defaultMaxSize : Integer.parseInt(size);
			if (s <= 0)
				throw new ConfigurationException("Array size of '" + tag + "' should be positive");
			sizes.add(s);
		}
		return JaniType.array(new ArrayInfo(base, sizes));
	}
}
