package nl.utwente.ewi.fmt.JANIGEN;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A property to check on the model. Properties are generated and
 * interpreted elsewhere; here they are only carried along.
 */
public class Property
{
	public final String name;
	private final Map<String, Object> definition;

	public Property(String name, Map<String, Object> definition)
	{
		this.name = name;
		this.definition = Collections.unmodifiableMap(new LinkedHashMap<>(definition));
	}

	public Map<String, Object> toJani() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ret.put("name", name);
		ret.putAll(definition);
		return ret;
	}

	public static Property fromJani(Object o) {
		Map<?, ?> m = JaniUtils.asMap(o, "Property");
		LinkedHashMap<String, Object> def = new LinkedHashMap<>();
		for (Map.Entry<?, ?> e : m.entrySet()) {
			if (!"name".equals(e.getKey()))
				def.put(e.getKey().toString(), e.getValue());
		}
		return new Property(JaniUtils.getString(m, "name"), def);
	}

	public String toString() {
		return "Property " + name;
	}
}
