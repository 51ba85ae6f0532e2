package nl.ennoruijters.util;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes the values produced by {@link JSONParser} (maps, lists,
 * strings, numbers, booleans and null) back as JSON text.
 */
public class JSONWriter
{
	private JSONWriter() {
	}

	public static void write(Object value, PrintStream out) {
		StringBuilder sb = new StringBuilder();
		append(sb, value, 0);
		out.println(sb);
	}

	public static String toString(Object value) {
		StringBuilder sb = new StringBuilder();
		append(sb, value, 0);
		return sb.toString();
	}

	private static void newLine(StringBuilder out, int indent) {
		out.append('\n');
		for (int i = 0; i < indent; i++)
			out.append('\t');
	}

	/* Arrays and objects without nested containers stay on one line. */
	private static boolean isFlat(Iterable<?> values) {
		for (Object o : values) {
			if (o instanceof Map || o instanceof List)
				return false;
		}
		return true;
	}

	private static void append(StringBuilder out, Object value, int indent) {
		if (value == null) {
			out.append("null");
		} else if (value instanceof String) {
			appendString(out, (String)value);
		} else if (value instanceof Boolean || value instanceof Long || value instanceof Integer) {
			out.append(value);
		} else if (value instanceof Double || value instanceof Float) {
			double d = ((Number)value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d))
				throw new IllegalArgumentException("Number not representable in JSON: " + d);
			out.append(d);
		} else if (value instanceof Map) {
			Map<?, ?> m = (Map<?, ?>)value;
			boolean flat = isFlat(m.values());
			out.append('{');
			Iterator<? extends Map.Entry<?, ?>> it = m.entrySet().iterator();
			while (it.hasNext()) {
				Map.Entry<?, ?> e = it.next();
				if (!flat)
					newLine(out, indent + 1);
				appendString(out, e.getKey().toString());
				out.append(": ");
				append(out, e.getValue(), indent + 1);
				if (it.hasNext())
					out.append(flat ? ", " : ",");
			}
			if (!flat && !m.isEmpty())
				newLine(out, indent);
			out.append('}');
		} else if (value instanceof List) {
			List<?> l = (List<?>)value;
			boolean flat = isFlat(l);
			out.append('[');
			for (int i = 0; i < l.size(); i++) {
				if (!flat)
					newLine(out, indent + 1);
				append(out, l.get(i), indent + 1);
				if (i + 1 < l.size())
					out.append(flat ? ", " : ",");
			}
			if (!flat && !l.isEmpty())
				newLine(out, indent);
			out.append(']');
		} else {
			throw new IllegalArgumentException("Cannot write " + value.getClass() + " as JSON: " + value);
		}
	}

	private static void appendString(StringBuilder out, String s) {
		out.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '"':
				out.append("\\\"");
				break;
			case '\\':
				out.append("\\\\");
				break;
			case '\n':
				out.append("\\n");
				break;
			case '\r':
				out.append("\\r");
				break;
			case '\t':
				out.append("\\t");
				break;
			default:
				if (c < 0x20)
					out.append(String.format("\\u%04x", (int)c));
				else
					out.append(c);
			}
		}
		out.append('"');
	}
}
