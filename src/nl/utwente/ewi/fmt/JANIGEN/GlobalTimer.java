package nl.utwente.ewi.fmt.JANIGEN;

import java.util.List;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.JANIGEN.PeriodicTimer.TimeUnit;
import nl.utwente.ewi.fmt.JANIGEN.expression.ConstantExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Expression;
import nl.utwente.ewi.fmt.JANIGEN.expression.Operator;
import nl.utwente.ewi.fmt.JANIGEN.expression.OperatorExpression;
import nl.utwente.ewi.fmt.JANIGEN.expression.VariableExpression;

/**
 * The automaton that advances time in steps of the greatest common
 * divisor of all timer periods. Time only advances once every timer
 * that is due has fired.
 */
public class GlobalTimer
{
	public static final String AUTOMATON_NAME = "global_timer";
	public static final String TICK_ACTION = "global_timer_tick";
	/** Action with which other automata allow a tick. */
	public static final String ENABLE_ACTION = "global_timer_enable";
	public static final String LOCATION = "loc";
	public static final String TIME_VARIABLE = "t";
	public static final String NEEDED_SUFFIX = "_needed";

	private GlobalTimer() {
	}

	/** The finest unit of the given timers. */
	public static TimeUnit commonUnit(List<PeriodicTimer> timers) {
		TimeUnit ret = TimeUnit.S;
		for (PeriodicTimer t : timers) {
			if (t.unit.exponent > ret.exponent)
				ret = t.unit;
		}
		return ret;
	}

	/** The greatest common divisor of the periods, in the common unit. */
	public static long commonStep(List<PeriodicTimer> timers) {
		TimeUnit unit = commonUnit(timers);
		long ret = 0;
		for (PeriodicTimer t : timers)
			ret = gcd(ret, t.getPeriodIn(unit));
		return ret;
	}

	private static long gcd(long a, long b) {
		while (b != 0) {
			long r = a % b;
			a = b;
			b = r;
		}
		return a;
	}

	static String neededVariable(PeriodicTimer t) {
		return t.name + NEEDED_SUFFIX;
	}

	/**
	 * Build the timer automaton.
	 *
	 * @param maxTimeNs Time after which the timer stops ticking.
	 */
	public static Automaton makeAutomaton(List<PeriodicTimer> timers, long maxTimeNs) {
		if (timers.isEmpty())
			throw new IllegalArgumentException("Global timer without timers");
		TimeUnit unit = commonUnit(timers);
		long step = commonStep(timers);
		long nsPerUnit = unit.factorTo(TimeUnit.NS);
		if (maxTimeNs <= 0 || maxTimeNs % nsPerUnit != 0)
			throw new ConfigurationException("Maximum time of " + maxTimeNs + " ns cannot be expressed in " + unit.symbol);
		long maxTime = maxTimeNs / nsPerUnit;

		Automaton ret = new Automaton(AUTOMATON_NAME);
		ret.addLocation(LOCATION, true);
		JaniType intType = JaniType.of(JaniBaseType.INTEGER);
		JaniType boolType = JaniType.of(JaniBaseType.BOOLEAN);
		ret.addVariable(new JaniVariable(TIME_VARIABLE, intType, new ConstantExpression(0L), false));
		VariableExpression time = new VariableExpression(TIME_VARIABLE);

		Expression tickGuard = OperatorExpression.binary(Operator.LESS,
				time, new ConstantExpression(maxTime));
		Edge.Assignment[] tickAssignments = new Edge.Assignment[timers.size() + 1];
		tickAssignments[0] = new Edge.Assignment(TIME_VARIABLE,
				OperatorExpression.binary(Operator.ADD, time, new ConstantExpression(step)), 0);
		for (int i = 0; i < timers.size(); i++) {
			PeriodicTimer t = timers.get(i);
			String needed = neededVariable(t);
			ret.addVariable(new JaniVariable(needed, boolType, ConstantExpression.TRUE, false));
			tickGuard = OperatorExpression.binary(Operator.AND, tickGuard,
					OperatorExpression.unary(Operator.NOT, new VariableExpression(needed)));
			Expression due = OperatorExpression.binary(Operator.EQUALS,
					OperatorExpression.binary(Operator.MODULO, time,
						new ConstantExpression(t.getPeriodIn(unit))),
					new ConstantExpression(0L));
			tickAssignments[i + 1] = new Edge.Assignment(needed, due, i + 1);
		}
		ret.addEdge(new Edge(LOCATION, TICK_ACTION, tickGuard,
				List.of(new Edge.Destination(LOCATION, null, List.of(tickAssignments)))));

		for (PeriodicTimer t : timers) {
			String needed = neededVariable(t);
			ret.addEdge(new Edge(LOCATION,
					Event.receiveAction(t.getEventName()),
					new VariableExpression(needed),
					List.of(new Edge.Destination(LOCATION, null,
						List.of(new Edge.Assignment(needed, ConstantExpression.FALSE, 0))))));
		}
		return ret;
	}
}
