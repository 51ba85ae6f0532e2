package nl.utwente.ewi.fmt.JANIGEN;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Converts a set of communicating state machines into one model. */
public class Convert
{
	private static final Logger LOG = LoggerFactory.getLogger(Convert.class);

	public static final String FEATURE_ARRAYS = "arrays";
	public static final String FEATURE_TRIGONOMETRY = "trigonometric-functions";

	private Convert() {
	}

	public static JaniModel convert(List<StateMachine> machines,
	                                List<PeriodicTimer> timers,
	                                ConversionOptions options)
	{
		JaniModel model = new JaniModel(options.modelName);
		model.addFeature(FEATURE_ARRAYS);
		model.addFeature(FEATURE_TRIGONOMETRY);

		EventRegistry events = new EventRegistry();
		AutomatonAssembler assembler = new AutomatonAssembler(events, options);
		for (StateMachine sm : machines)
			model.addAutomaton(assembler.assemble(sm));
		if (!timers.isEmpty())
			model.addAutomaton(GlobalTimer.makeAutomaton(timers, options.maxTimeNs));

		EventSynchronizer.implementEvents(events, timers, model, options.maxArraySize);
		for (Automaton a : model.getAutomata()) {
			if (!InterfaceKind.isHandlerAutomaton(a.getName()))
				continue;
			int removed = a.removeEmptySelfLoopEdges();
			if (removed > 0)
				LOG.debug("Removed {} empty self-loops from {}", removed, a.getName());
		}
		DistributionExpander.expand(model, options.distributionResolution);
		model.preprocessExpressions();

		LOG.info("Converted {} state machines into model '{}': {} automata, {} global variables, {} syncs",
				machines.size(), model.getName(), model.getAutomata().size(),
				model.getVariables().size(),
				model.getComposition().getSyncs().size());
		return model;
	}

	public static void writeJaniFile(JaniModel model, String filename) throws IOException {
		try (PrintStream out = new PrintStream(filename, "UTF-8")) {
			model.writeJani(out);
		}
	}
}
