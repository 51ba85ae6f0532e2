package nl.utwente.ewi.fmt.JANIGEN;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A timer firing at a fixed rate. The period is stored as an integer
 * in the coarsest time unit that represents it exactly.
 */
public class PeriodicTimer
{
	private static final Logger LOG = LoggerFactory.getLogger(PeriodicTimer.class);

	/* Periods longer than this many units are rounded down instead of
	 * moving to a finer unit. */
	private static final long MAX_INEXACT_PERIOD = 100;

	public enum TimeUnit {
		S("s", 0),
		MS("ms", 3),
		US("us", 6),
		NS("ns", 9);

		public final String symbol;
		/** Unit is 10^-exponent seconds. */
		public final int exponent;

		TimeUnit(String symbol, int exponent) {
			this.symbol = symbol;
			this.exponent = exponent;
		}

		/** The number of units of {@code finer} in one of this unit. */
		public long factorTo(TimeUnit finer) {
			if (finer.exponent < exponent)
				throw new IllegalArgumentException(finer + " is coarser than " + this);
			return pow10(finer.exponent - exponent);
		}
	}

	public final String name;
	public final double rateHz;
	public final long period;
	public final TimeUnit unit;

	public PeriodicTimer(String name, double rateHz)
	{
		if (name == null || name.isEmpty())
			throw new ConfigurationException("Timers need a name");
		if (!(rateHz > 0) || Double.isInfinite(rateHz))
			throw new ConfigurationException("Rate of timer '" + name + "' should be positive, not: " + rateHz);
		this.name = name;
		this.rateHz = rateHz;
		long p = 0;
		TimeUnit u = null;
		for (TimeUnit cand : TimeUnit.values()) {
			double exact = pow10(cand.exponent) / rateHz;
			long truncated = (long)Math.floor(exact);
			if (truncated == exact && truncated > 0) {
				p = truncated;
				u = cand;
				break;
			}
			if (truncated > MAX_INEXACT_PERIOD || (cand == TimeUnit.NS && truncated > 0)) {
				LOG.warn("Period of timer '{}' ({} Hz) truncated to {} {}", name, rateHz, truncated, cand.symbol);
				p = truncated;
				u = cand;
				break;
			}
		}
		if (u == null)
			throw new ConfigurationException("Rate of timer '" + name + "' is too high: " + rateHz + " Hz");
		this.period = p;
		this.unit = u;
	}

	static long pow10(int exponent) {
		long ret = 1;
		for (int i = 0; i < exponent; i++)
			ret *= 10;
		return ret;
	}

	/** The name of the event sent each time the timer fires. */
	public String getEventName() {
		return InterfaceKind.TIMER.eventName(name, null);
	}

	public long getPeriodIn(TimeUnit finer) {
		return period * unit.factorTo(finer);
	}

	public String toString() {
		return "Timer " + name + " (" + period + " " + unit.symbol + ")";
	}
}
