package nl.utwente.ewi.fmt.JANIGEN;

import java.util.Properties;

/** Settings of a conversion. */
public class ConversionOptions
{
	public static final String DEFAULT_MODEL_NAME = "janigen_model";
	public static final int DEFAULT_MAX_ARRAY_SIZE = 100;
	public static final int DEFAULT_DISTRIBUTION_RESOLUTION = 100;
	public static final long DEFAULT_MAX_TIME_NS = 100_000_000_000L;

	public static final String MODEL_NAME_KEY = "janigen.model_name";
	public static final String MAX_ARRAY_SIZE_KEY = "janigen.max_array_size";
	public static final String DISTRIBUTION_RESOLUTION_KEY = "janigen.distribution_resolution";
	public static final String MAX_TIME_KEY = "janigen.max_time_ns";

	public static final ConversionOptions DEFAULT = new ConversionOptions(
			DEFAULT_MODEL_NAME, DEFAULT_MAX_ARRAY_SIZE,
			DEFAULT_DISTRIBUTION_RESOLUTION, DEFAULT_MAX_TIME_NS);

	public final String modelName;
	/** Size of arrays declared without one. */
	public final int maxArraySize;
	/** Number of values each random distribution is split into. */
	public final int distributionResolution;
	/** Time at which the global timer stops. */
	public final long maxTimeNs;

	public ConversionOptions(String modelName, int maxArraySize,
	                         int distributionResolution, long maxTimeNs)
	{
		if (modelName == null || modelName.isEmpty())
			throw new ConfigurationException("Model name should not be empty");
		if (maxArraySize <= 0)
			throw new ConfigurationException("Maximum array size should be positive, not: " + maxArraySize);
		if (distributionResolution <= 0)
			throw new ConfigurationException("Distribution resolution should be positive, not: " + distributionResolution);
		if (maxTimeNs <= 0)
			throw new ConfigurationException("Maximum time should be positive, not: " + maxTimeNs);
		this.modelName = modelName;
		this.maxArraySize = maxArraySize;
		this.distributionResolution = distributionResolution;
		this.maxTimeNs = maxTimeNs;
	}

	/**
	 * Read the options from properties, using the defaults for
	 * missing keys.
	 */
	public static ConversionOptions fromProperties(Properties props) {
		return new ConversionOptions(
				props.getProperty(MODEL_NAME_KEY, DEFAULT_MODEL_NAME),
				getInt(props, MAX_ARRAY_SIZE_KEY, DEFAULT_MAX_ARRAY_SIZE),
				getInt(props, DISTRIBUTION_RESOLUTION_KEY, DEFAULT_DISTRIBUTION_RESOLUTION),
				getLong(props, MAX_TIME_KEY, DEFAULT_MAX_TIME_NS));
	}

	private static int getInt(Properties props, String key, int dfl) {
		try {
			return JaniUtils.safeToInteger(getLong(props, key, dfl));
		} catch (ArithmeticException e) {
			throw new ConfigurationException("Option " + key + " is too large", e);
		}
	}

	private static long getLong(Properties props, String key, long dfl) {
		String v = props.getProperty(key);
		if (v == null)
			return dfl;
		try {
			return Long.parseLong(v.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Option " + key + " should be an integer, not: " + v, e);
		}
	}

	public ConversionOptions withModelName(String name) {
		return new ConversionOptions(name, maxArraySize, distributionResolution, maxTimeNs);
	}

	public ConversionOptions withMaxArraySize(int size) {
		return new ConversionOptions(modelName, size, distributionResolution, maxTimeNs);
	}

	public ConversionOptions withDistributionResolution(int resolution) {
		return new ConversionOptions(modelName, maxArraySize, resolution, maxTimeNs);
	}

	public ConversionOptions withMaxTimeNs(long ns) {
		return new ConversionOptions(modelName, maxArraySize, distributionResolution, ns);
	}

	public String toString() {
		return "model " + modelName + ", arrays of " + maxArraySize
		       + ", " + distributionResolution + " values per distribution, max time "
		       + maxTimeNs + " ns";
	}
}
