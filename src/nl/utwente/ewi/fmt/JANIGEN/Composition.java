package nl.utwente.ewi.fmt.JANIGEN;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The synchronization table of a model: the participating automata
 * and, for every synchronized action, which action each automaton
 * contributes (or null if it does not take part).
 */
public class Composition
{
	public static class Sync {
		public final String result;
		/** One entry per element, null for non-participants. */
		public final List<String> vector;

		private Sync(String result, String[] vector)
		{
			this.result = result;
			this.vector = Collections.unmodifiableList(Arrays.asList(vector));
		}
	}

	private final ArrayList<String> elements = new ArrayList<>();
	private final LinkedHashMap<String, String[]> syncs = new LinkedHashMap<>();

	/**
	 * Add an automaton to the composition. It takes part in none of
	 * the existing syncs.
	 */
	public void addElement(String automaton) {
		if (elements.contains(automaton))
			throw new InvalidModelException("Automaton '" + automaton + "' is already part of the composition");
		elements.add(automaton);
		for (Map.Entry<String, String[]> s : syncs.entrySet())
			s.setValue(Arrays.copyOf(s.getValue(), elements.size()));
	}

	public List<String> getElements() {
		return Collections.unmodifiableList(elements);
	}

	/**
	 * Add a sync.
	 *
	 * @param result The action of the composed system.
	 * @param participants The action of every participating
	 * automaton.
	 */
	public void addSync(String result, Map<String, String> participants) {
		if (syncs.containsKey(result))
			throw new InvalidModelException("Duplicate sync: " + result);
		if (participants.isEmpty())
			throw new InvalidModelException("Sync '" + result + "' has no participants");
		String[] vector = new String[elements.size()];
		for (Map.Entry<String, String> p : participants.entrySet()) {
			int i = elements.indexOf(p.getKey());
			if (i < 0)
				throw new InvalidModelException("Sync '" + result + "' refers to automaton '" + p.getKey() + "' outside the composition");
			vector[i] = p.getValue();
		}
		syncs.put(result, vector);
	}

	public boolean hasSync(String result) {
		return syncs.containsKey(result);
	}

	/** The syncs, in the order they were added. */
	public List<Sync> getSyncs() {
		ArrayList<Sync> ret = new ArrayList<>(syncs.size());
		for (Map.Entry<String, String[]> s : syncs.entrySet())
			ret.add(new Sync(s.getKey(), s.getValue()));
		return ret;
	}

	/** The participating automata of a sync and their actions. */
	public Map<String, String> getParticipants(String result) {
		String[] vector = syncs.get(result);
		if (vector == null)
			throw new IllegalArgumentException("No sync: " + result);
		LinkedHashMap<String, String> ret = new LinkedHashMap<>();
		for (int i = 0; i < vector.length; i++) {
			if (vector[i] != null)
				ret.put(elements.get(i), vector[i]);
		}
		return ret;
	}

	/** The actions with which an automaton takes part in any sync. */
	public Set<String> getSyncsForElement(String automaton) {
		int i = elements.indexOf(automaton);
		TreeSet<String> ret = new TreeSet<>();
		if (i < 0)
			return ret;
		for (String[] vector : syncs.values()) {
			if (vector[i] != null)
				ret.add(vector[i]);
		}
		return ret;
	}

	/** Whether every sync vector has one entry per element. */
	public boolean isValid() {
		for (String[] vector : syncs.values()) {
			if (vector.length != elements.size())
				return false;
		}
		return true;
	}

	public Map<String, Object> toJani() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		ArrayList<Object> elems = new ArrayList<>();
		for (String e : elements)
			elems.add(Map.of("automaton", e));
		ret.put("elements", elems);
		ArrayList<Object> ss = new ArrayList<>();
		for (Map.Entry<String, String[]> s : new TreeMap<>(syncs).entrySet()) {
			LinkedHashMap<String, Object> sync = new LinkedHashMap<>();
			sync.put("result", s.getKey());
			sync.put("synchronise", new ArrayList<>(Arrays.asList(s.getValue())));
			ss.add(sync);
		}
		ret.put("syncs", ss);
		return ret;
	}

	public static Composition fromJani(Object o) {
		Map<?, ?> m = JaniUtils.asMap(o, "System");
		Composition ret = new Composition();
		for (Object e : JaniUtils.getList(m, "elements"))
			ret.addElement(JaniUtils.getString(JaniUtils.asMap(e, "Composition element"), "automaton"));
		for (Object s : JaniUtils.getList(m, "syncs")) {
			Map<?, ?> sm = JaniUtils.asMap(s, "Sync");
			List<?> vector = JaniUtils.getList(sm, "synchronise");
			if (vector.size() != ret.elements.size())
				throw new IllegalArgumentException("Sync vector " + vector + " should have " + ret.elements.size() + " entries");
			LinkedHashMap<String, String> participants = new LinkedHashMap<>();
			for (int i = 0; i < vector.size(); i++) {
				Object a = vector.get(i);
				if (a == null)
					continue;
				if (!(a instanceof String))
					throw new IllegalArgumentException("Synchronised action should be a string, not: " + a);
				participants.put(ret.elements.get(i), (String)a);
			}
			ret.addSync(JaniUtils.getString(sm, "result"), participants);
		}
		return ret;
	}
}
